package com.errlens.core.extractor;

/**
 * Fixed rubric for detection confidence scores.
 *
 * <p><b>Levels:</b></p>
 * <ul>
 *   <li><b>UNAMBIGUOUS:</b> structural marker such as a report header</li>
 *   <li><b>DISTINCTIVE:</b> very tool-specific token combination</li>
 *   <li><b>STRONG:</b> several independent signals agree</li>
 *   <li><b>SINGLE_SIGNAL:</b> one strong signal</li>
 *   <li><b>GENERIC_WORDING:</b> wording many tools share</li>
 *   <li><b>FALLBACK:</b> nothing specific matched</li>
 * </ul>
 */
public enum DetectionConfidence {
    UNAMBIGUOUS(100),
    DISTINCTIVE(95),
    STRONG(90),
    SINGLE_SIGNAL(85),
    GENERIC_WORDING(80),
    FALLBACK(50);

    private final int score;

    DetectionConfidence(int score) {
        this.score = score;
    }

    public int score() {
        return score;
    }
}
