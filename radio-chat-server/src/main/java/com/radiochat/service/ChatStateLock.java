package com.radiochat.service;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * 접속자/방 멤버십/송신권 상태를 보호하는 단일 락.
 * 입장-이동, 송신권 획득-거절 같은 전이는 이 락 안에서 한 번에 수행된다.
 */
@Component
public class ChatStateLock {

    private final ReentrantLock lock = new ReentrantLock();

    public <T> T call(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void run(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }
}
