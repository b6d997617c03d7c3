package org.rrview.routing.netlist;

import org.rrview.core.id.IDMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, id-ordered collection of routed nets with name lookup.
 */
public final class RoutedNetlist {
    private final List<RoutedNet> nets;
    private final IDMapper netNames;

    public RoutedNetlist(List<RoutedNet> nets) {
        Objects.requireNonNull(nets, "nets");
        List<String> names = new ArrayList<>(nets.size());
        for (int i = 0; i < nets.size(); i++) {
            RoutedNet net = Objects.requireNonNull(nets.get(i), "nets[" + i + "]");
            if (net.id() != i) {
                throw new IllegalArgumentException("Net ids must be dense and ordered: index " + i
                        + " holds net " + net.id());
            }
            names.add(net.name());
        }
        this.nets = Collections.unmodifiableList(new ArrayList<>(nets));
        this.netNames = IDMapper.fromOrderedNames(names);
    }

    public int size() {
        return nets.size();
    }

    public RoutedNet net(int netId) {
        if (netId < 0 || netId >= nets.size()) {
            throw new IndexOutOfBoundsException("Net " + netId + " out of bounds [0, " + nets.size() + ")");
        }
        return nets.get(netId);
    }

    /**
     * @throws IDMapper.UnknownIDException if no net has this name.
     */
    public RoutedNet netByName(String name) {
        return nets.get(netNames.toInternal(name));
    }

    public boolean containsNet(int netId) {
        return netNames.containsInternal(netId);
    }

    public List<RoutedNet> nets() {
        return nets;
    }
}
