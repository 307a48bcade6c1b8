package com.example.orchestrator.event;

public interface OrchestratorEventListener {

    void onLifecycleEvent(OrchestratorEvent event);

    void onMessageEvent(MessageRecordedEvent event);
}
