package com.williamcallahan.corpussync.web;

import com.williamcallahan.corpussync.sync.CycleStatus;

/**
 * Body of an accepted or conflicting trigger.
 *
 * @param cycleId accepted cycle, or the still-running one on conflict
 * @param source triggered source
 * @param status cycle status
 */
public record TriggerResponse(String cycleId, String source, CycleStatus status) {}
