package com.goormthonuniv.factcheck.resilience;

import java.util.List;

/**
 * 모든 후보 모델과 재시도가 실패했을 때 한 번만 던져지는 종결 에러.
 * 원장은 진단용이며 HTTP 응답에는 싣지 않는다.
 */
public class ExhaustedCascadeException extends RuntimeException {

    private final List<AttemptRecord> attempts;
    private final List<String> modelsAttempted;

    public ExhaustedCascadeException(List<AttemptRecord> attempts) {
        this(List.copyOf(attempts), distinctModels(attempts));
    }

    private ExhaustedCascadeException(List<AttemptRecord> attempts, List<String> models) {
        super("All " + attempts.size() + " attempts failed across " + models.size()
                + " model(s): " + String.join(", ", models));
        this.attempts = attempts;
        this.modelsAttempted = models;
    }

    public List<AttemptRecord> getAttempts() { return attempts; }

    public int getAttemptCount() { return attempts.size(); }

    public List<String> getModelsAttempted() { return modelsAttempted; }

    private static List<String> distinctModels(List<AttemptRecord> attempts) {
        return attempts.stream().map(AttemptRecord::modelId).distinct().toList();
    }
}
