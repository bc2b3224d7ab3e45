package com.ecgheartbeat.backend.service.classification;

import com.ecgheartbeat.backend.entity.EcgStatus;
import org.springframework.stereotype.Component;

/**
 * Maps a resting heart rate to a status and condition label.
 * The normal band is inclusive on both ends.
 */
@Component
public class HeartRateClassifier {

    public static final int LOWER_NORMAL_BPM = 60;
    public static final int UPPER_NORMAL_BPM = 100;

    static final String BRADYCARDIA = "Bradycardia — low heart rate (<60 BPM)";
    static final String TACHYCARDIA = "Tachycardia — high heart rate (>100 BPM)";
    static final String NORMAL_RANGE = "Heart rate within normal range (60–100 BPM)";

    public HeartRateAssessment classify(int bpm) {
        if (bpm < LOWER_NORMAL_BPM) {
            return new HeartRateAssessment(EcgStatus.ABNORMAL, BRADYCARDIA);
        }
        if (bpm > UPPER_NORMAL_BPM) {
            return new HeartRateAssessment(EcgStatus.ABNORMAL, TACHYCARDIA);
        }
        return new HeartRateAssessment(EcgStatus.NORMAL, NORMAL_RANGE);
    }
}
