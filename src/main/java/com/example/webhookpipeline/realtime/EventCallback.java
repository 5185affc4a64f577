package com.example.webhookpipeline.realtime;

@FunctionalInterface
public interface EventCallback {

    void onEvent(RealtimeEvent event) throws Exception;
}
