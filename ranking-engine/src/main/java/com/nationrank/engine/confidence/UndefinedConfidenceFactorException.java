package com.nationrank.engine.confidence;

import com.nationrank.engine.SliceComputationException;
import com.nationrank.engine.model.TimeWindow;

/**
 * Thrown when no nation recorded a decided game in a slice, leaving k and CF undefined.
 */
public class UndefinedConfidenceFactorException extends SliceComputationException {

    public static final String REASON = "CONFIDENCE_FACTOR_UNDEFINED";

    public UndefinedConfidenceFactorException(String gameMode, TimeWindow window) {
        super(gameMode, REASON, String.format(
                "No nation recorded a decided %s game in %s; confidence factor is undefined", gameMode, window));
    }
}
