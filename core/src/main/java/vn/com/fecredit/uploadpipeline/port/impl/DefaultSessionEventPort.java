package vn.com.fecredit.uploadpipeline.port.impl;

import vn.com.fecredit.uploadpipeline.model.SessionEvent;
import vn.com.fecredit.uploadpipeline.port.interfaces.ISessionEventPort;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default in-memory implementation of ISessionEventPort.
 */
public class DefaultSessionEventPort implements ISessionEventPort {

    private final Map<String, List<SessionEvent>> eventsBySession = new ConcurrentHashMap<>();

    @Override
    public void append(SessionEvent event) {
        List<SessionEvent> events = eventsBySession.computeIfAbsent(event.getSessionId(), k -> new ArrayList<>());
        synchronized (events) {
            events.add(event);
        }
    }

    @Override
    public List<SessionEvent> findEvents(String sessionId) {
        List<SessionEvent> events = eventsBySession.get(sessionId);
        if (events == null) {
            return List.of();
        }
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    @Override
    public void deleteEvents(String sessionId) {
        eventsBySession.remove(sessionId);
    }
}
