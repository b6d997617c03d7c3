package org.rrview.routing.netlist;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Arrays;
import java.util.Objects;

/**
 * One net of the clustered netlist together with its physical route.
 *
 * <p>Terminal 0 is the driver's SOURCE node; the remaining terminals are the SINK
 * nodes of the loads, in net-pin order.</p>
 */
@Getter
@Accessors(fluent = true)
public final class RoutedNet {
    private final int id;
    private final String name;
    /** Global nets (clocks, resets) use dedicated networks and are never drawn. */
    private final boolean global;
    private final Traceback traceback;
    @Getter(AccessLevel.NONE)
    private final int[] terminals;

    public RoutedNet(int id, String name, boolean global, int[] terminals, Traceback traceback) {
        if (id < 0) {
            throw new IllegalArgumentException("net id must be >= 0, got " + id);
        }
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        this.global = global;
        this.terminals = Objects.requireNonNull(terminals, "terminals").clone();
        this.traceback = traceback == null ? Traceback.empty() : traceback;
    }

    public int pinCount() {
        return terminals.length;
    }

    /**
     * Returns the rr terminal node of a net pin.
     */
    public int terminal(int pinIndex) {
        if (pinIndex < 0 || pinIndex >= terminals.length) {
            throw new IndexOutOfBoundsException(
                    "Net " + id + " pin " + pinIndex + " out of bounds [0, " + terminals.length + ")");
        }
        return terminals[pinIndex];
    }

    public int driverTerminal() {
        return terminal(0);
    }

    public boolean isRouted() {
        return !traceback.isEmpty();
    }

    @Override
    public String toString() {
        return "RoutedNet[id=" + id + ", name=" + name + ", global=" + global
                + ", terminals=" + Arrays.toString(terminals) + ", traceback=" + traceback.size() + "]";
    }
}
