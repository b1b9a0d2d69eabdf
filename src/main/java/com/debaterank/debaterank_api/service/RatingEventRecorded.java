package com.debaterank.debaterank_api.service;

import com.debaterank.debaterank_api.model.RatingEvent;

/** Published inside the append transaction; listeners act after commit. */
public record RatingEventRecorded(RatingEvent event) {}
