package org.rrview.routing.selection;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.rrview.routing.graph.RRGraph;
import org.rrview.routing.netlist.RoutedNet;
import org.rrview.routing.netlist.RoutedNetlist;
import org.rrview.routing.spatial.HitTester;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns point queries (clicks and mouse moves) into selection changes and status text.
 * <p>
 * A click on an unselected node selects it, a click on a selected node deselects it.
 * When rr nodes are displayed the node's fan-in and fan-out are marked (or cleared);
 * when nets are displayed every net's highlight is recomputed.
 * <p>
 * The controller remembers the text of the last selection so that moving the mouse
 * off a wire restores it.
 * <p>
 * <strong>Thread Safety:</strong> not thread-safe.
 */
public final class SelectionController {
    private static final Logger LOG = Logger.getLogger(SelectionController.class.getName());

    private final RoutedNetlist netlist;
    private final HitTester hitTester;
    @Getter
    @Accessors(fluent = true)
    private final SelectionState state;
    private final NodeDescriber describer;
    private final RRDisplayMode rrDisplay;
    private final boolean showNets;
    private final String defaultMessage;

    private String selectionMessage;

    @Builder
    private SelectionController(
            RRGraph graph,
            RoutedNetlist netlist,
            HitTester hitTester,
            SelectionState state,
            RRDisplayMode rrDisplay,
            boolean showNets,
            String defaultMessage
    ) {
        Objects.requireNonNull(graph, "graph");
        this.netlist = Objects.requireNonNull(netlist, "netlist");
        this.hitTester = Objects.requireNonNull(hitTester, "hitTester");
        this.state = Objects.requireNonNull(state, "state");
        this.rrDisplay = rrDisplay == null ? RRDisplayMode.NONE : rrDisplay;
        this.showNets = showNets;
        this.defaultMessage = defaultMessage == null ? "" : defaultMessage;
        this.describer = new NodeDescriber(graph);
        if (state.nodeCount() != graph.nodeCount() || state.netCount() != netlist.size()) {
            throw new IllegalArgumentException("selection state does not match graph and netlist");
        }
    }

    /**
     * Handles a click at (x, y) in drawing coordinates.
     */
    public SelectionOutcome click(double x, double y) {
        if (!rrDisplay.showsNodes() && !showNets) {
            return SelectionOutcome.ignored();
        }
        OptionalInt hit = hitTester.hitTest(x, y);
        if (hit.isEmpty()) {
            selectionMessage = null;
            return SelectionOutcome.builder().handled(true).message(defaultMessage).build();
        }

        int node = hit.getAsInt();
        NodeHighlight newState = state.nodeState(node) == NodeHighlight.PRIMARY_SELECTED
                ? NodeHighlight.DESELECTED
                : NodeHighlight.PRIMARY_SELECTED;
        state.highlight(node, newState);

        SelectionOutcome.SelectionOutcomeBuilder outcome = SelectionOutcome.builder()
                .handled(true)
                .node(node)
                .state(newState);
        if (rrDisplay.showsNodes()) {
            outcome.fanoutTouched(state.propagateFanout(node));
            outcome.faninTouched(state.propagateFanin(node));
        }

        StringBuilder message = new StringBuilder();
        if (newState == NodeHighlight.PRIMARY_SELECTED) {
            message.append(describer.selected(node));
        }
        if (showNets) {
            for (RoutedNet net : netlist.nets()) {
                if (net.global()) {
                    continue;
                }
                state.aggregateNet(net.id(), net.traceback());
                if (newState == NodeHighlight.PRIMARY_SELECTED && net.traceback().contains(node)) {
                    outcome.net(net.id());
                    message.append(" || Net: ").append(net.id()).append(" (").append(net.name()).append(')');
                }
            }
        }

        // a deselect produces no text and keeps the previous selection text
        if (newState == NodeHighlight.PRIMARY_SELECTED) {
            selectionMessage = message.toString();
            LOG.info(selectionMessage);
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine(describer.dump(node));
            }
        }
        return outcome.message(message.toString()).build();
    }

    /**
     * Status text for the mouse at (x, y): the hovered wire or pin, else the last
     * selection text, else the default message. Empty unless rr nodes are displayed.
     */
    public Optional<String> mouseOver(double x, double y) {
        if (!rrDisplay.showsNodes()) {
            return Optional.empty();
        }
        OptionalInt hit = hitTester.hitTest(x, y);
        if (hit.isPresent()) {
            Optional<String> hover = describer.hover(hit.getAsInt());
            if (hover.isPresent()) {
                return hover;
            }
        }
        return Optional.of(selectionMessage != null ? selectionMessage : defaultMessage);
    }

    /**
     * Clears every node and net highlight and forgets the selection text.
     */
    public void deselectAll() {
        state.clear();
        selectionMessage = null;
        LOG.info("deselected all rr nodes and nets");
    }

    public Optional<String> selectionMessage() {
        return Optional.ofNullable(selectionMessage);
    }

    public RRDisplayMode rrDisplay() {
        return rrDisplay;
    }

    public boolean showNets() {
        return showNets;
    }
}
