package com.goormthonuniv.factcheck.resilience;

import java.time.Duration;

/** 재시도 사이 대기. 테스트에서는 실제로 잠들지 않는 구현으로 바꿔 끼운다. */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
