package com.switchboard.dispatch.api;

import com.switchboard.core.model.TrainingExample;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/training/examples. Example timestamps are
 * ignored and assigned on receipt.
 */
public record TrainingRequest(
    List<TrainingExample> examples
) {}
