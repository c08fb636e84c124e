package com.goormthonuniv.factcheck.llm;

public interface LlmClient {
    /**
     * 단일 모델 호출. 자체 네트워크 재시도 예산({@link LlmCall#networkRetries()})을 소진한 뒤에도
     * 실패하면 {@link LlmTransportException}.
     *
     * @return 모델이 돌려준 본문(공백뿐인 응답은 실패로 취급)
     */
    String complete(LlmCall call);
}
