package kr.crownrpg.chat.api.lifecycle;

/**
 * 채팅 코어 구성요소의 시작/종료 계약.
 */
public interface ManagedLifecycle {

    void start();

    void stop();
}
