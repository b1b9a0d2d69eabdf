package com.debaterank.debaterank_api.controller.dto;

public record ApiError(String code, String message, String path) {}
