package com.myorg.cafe.deadletter;

public interface DeadLetterHooks {
    default void afterEnqueue(DeadLetter letter) {}
    default void beforeRedrive(DeadLetter letter) {}
}
