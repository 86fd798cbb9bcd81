package com.questrail.scenario.api;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Test simulator that records every signal command, in order, as a string
 * such as {@code "setColor(1, Green)"}.
 * <p>
 * Commands for ids marked with {@link #rejectSignal(int)} return {@code false};
 * commands for ids marked with {@link #breakSignal(int)} throw.
 */
public final class RecordingSimulatorApi implements SimulatorApi {
    private final List<String> commands = new ArrayList<>();
    private final Map<String, Double> speeds = new HashMap<>();
    private final Set<Integer> rejected = new HashSet<>();
    private final Set<Integer> broken = new HashSet<>();

    private Duration time = Duration.ZERO;

    public RecordingSimulatorApi withTime(Duration time) {
        this.time = time;
        return this;
    }

    public RecordingSimulatorApi withSpeed(String entity, double speed) {
        speeds.put(entity, speed);
        return this;
    }

    public RecordingSimulatorApi rejectSignal(int signalId) {
        rejected.add(signalId);
        return this;
    }

    public RecordingSimulatorApi breakSignal(int signalId) {
        broken.add(signalId);
        return this;
    }

    public List<String> commands() {
        return new ArrayList<>(commands);
    }

    public void clearCommands() {
        commands.clear();
    }

    @Override
    public Duration simulationTime() {
        return time;
    }

    @Override
    public double entitySpeed(String entityName) {
        Double speed = speeds.get(entityName);
        if (speed == null) {
            throw new IllegalArgumentException("Unknown entity " + entityName);
        }
        return speed;
    }

    @Override
    public boolean setTrafficLightColor(int signalId, Color color) {
        return record(signalId, "setColor(" + signalId + ", " + color.wireName() + ")");
    }

    @Override
    public boolean resetTrafficLightColor(int signalId) {
        return record(signalId, "resetColor(" + signalId + ")");
    }

    @Override
    public boolean setTrafficLightArrow(int signalId, Arrow arrow) {
        return record(signalId, "setArrow(" + signalId + ", " + arrow.wireName() + ")");
    }

    @Override
    public boolean resetTrafficLightArrows(int signalId) {
        return record(signalId, "resetArrows(" + signalId + ")");
    }

    private boolean record(int signalId, String command) {
        commands.add(command);
        if (broken.contains(signalId)) {
            throw new IllegalStateException("signal " + signalId + " is out of order");
        }
        return !rejected.contains(signalId);
    }
}
