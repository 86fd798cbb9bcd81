package com.questrail.scenario.intersection;

import com.questrail.scenario.api.Arrow;
import com.questrail.scenario.api.Color;
import com.questrail.scenario.api.SimulatorApi;
import com.questrail.scenario.observability.ActuatorFailureEvent.Command;

import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * SignalTransition
 * -----------------------------------------------------------------------------
 * The commands one intersection state issues for one signal: a color and the
 * set of arrows that must be lit.
 *
 * <h2>Command order</h2>
 * Applying a transition always issues, in this order:
 * <ol>
 *   <li>the color command, or a color reset when the color is {@link Color#BLANK}</li>
 *   <li>an arrow reset</li>
 *   <li>one arrow command per declared arrow, in declaration order</li>
 * </ol>
 * Arrows are reset on every application, independently of the color, so a
 * state never inherits arrows from the previous one.
 *
 * <h2>Best effort</h2>
 * A command the simulator rejects (or throws on) is reported to the
 * {@link CommandFailureListener} and the remaining commands are still issued.
 * There is no rollback.
 */
public final class SignalTransition
{
    /**
     * Receives commands the simulator did not accept.
     */
    @FunctionalInterface
    public interface CommandFailureListener {
        /**
         * @param cause thrown exception, or {@code null} for a {@code false} return
         */
        void onCommandFailure(int signalId, Command command, String argument, Throwable cause);
    }

    private final int signalId;
    private final Color color;
    private final List<Arrow> arrows;

    public SignalTransition(int signalId, Color color, List<Arrow> arrows) {
        this.signalId = signalId;
        this.color = Objects.requireNonNull(color, "color");
        this.arrows = Objects.requireNonNull(arrows, "arrows").stream()
                .filter(arrow -> arrow != Arrow.BLANK)
                .toList();
    }

    /**
     * A transition that turns a signal off: blank color, no arrows.
     */
    public static SignalTransition reset(int signalId) {
        return new SignalTransition(signalId, Color.BLANK, List.of());
    }

    public int signalId() {
        return signalId;
    }

    public Color color() {
        return color;
    }

    /**
     * Arrows to light, {@link Arrow#BLANK} entries already removed.
     */
    public List<Arrow> arrows() {
        return arrows;
    }

    /**
     * Issues this transition's commands.
     *
     * @return {@code true} if the simulator accepted every command
     */
    public boolean apply(SimulatorApi simulator, CommandFailureListener listener) {
        Objects.requireNonNull(simulator, "simulator");
        Objects.requireNonNull(listener, "listener");

        boolean acknowledged;
        if (color == Color.BLANK) {
            acknowledged = issue(Command.RESET_COLOR, "",
                    () -> simulator.resetTrafficLightColor(signalId), listener);
        } else {
            acknowledged = issue(Command.SET_COLOR, color.wireName(),
                    () -> simulator.setTrafficLightColor(signalId, color), listener);
        }

        acknowledged &= issue(Command.RESET_ARROWS, "",
                () -> simulator.resetTrafficLightArrows(signalId), listener);

        for (Arrow arrow : arrows) {
            acknowledged &= issue(Command.SET_ARROW, arrow.wireName(),
                    () -> simulator.setTrafficLightArrow(signalId, arrow), listener);
        }
        return acknowledged;
    }

    private boolean issue(Command command, String argument, BooleanSupplier call,
                          CommandFailureListener listener) {
        try {
            if (call.getAsBoolean()) {
                return true;
            }
            listener.onCommandFailure(signalId, command, argument, null);
        } catch (RuntimeException e) {
            listener.onCommandFailure(signalId, command, argument, e);
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SignalTransition that)) return false;
        return signalId == that.signalId && color == that.color && arrows.equals(that.arrows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(signalId, color, arrows);
    }

    @Override
    public String toString() {
        return "Signal " + signalId + ": " + color + " " + arrows;
    }
}
