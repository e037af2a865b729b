package com.dispatch.adapters;

@FunctionalInterface
public interface EventSink {
    void emit(AdapterEvent event);
}
