package io.netnotes.fastscroll.state;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Flag-based state machine. Each bit of a BigInteger is an independent
 * state; actions registered on a bit run when it is added or removed.
 */
public class BitFlagStateMachine {

    private final String m_id;
    private BigInteger m_state = BigInteger.ZERO;
    private final Map<BigInteger, List<StateTransition>> m_transitions = new ConcurrentHashMap<>();

    public BitFlagStateMachine(String id) {
        this.m_id = id;
    }

    // ========== State Queries ==========

    public boolean hasState(int bitPosition) {
        return m_state.testBit(bitPosition);
    }

    // ========== State Mutations ==========

    /**
     * @return true if the bit was not already set
     */
    public boolean addState(int bitPosition) {
        if (hasState(bitPosition)) {
            return false;
        }
        BigInteger oldState = m_state;
        m_state = m_state.setBit(bitPosition);
        runTransitions(bit(bitPosition), true, oldState);
        return true;
    }

    /**
     * @return true if the bit was set
     */
    public boolean removeState(int bitPosition) {
        if (!hasState(bitPosition)) {
            return false;
        }
        BigInteger oldState = m_state;
        m_state = m_state.clearBit(bitPosition);
        runTransitions(bit(bitPosition), false, oldState);
        return true;
    }

    /**
     * Adds or removes a state bit.
     *
     * @return true if the state changed
     */
    public boolean setState(int bitPosition, boolean value) {
        return value ? addState(bitPosition) : removeState(bitPosition);
    }

    // ========== Transitions ==========

    @FunctionalInterface
    public interface TransitionAction {
        void onTransition(BigInteger oldState, BigInteger newState, BigInteger triggerBit);
    }

    private static final class StateTransition {
        final boolean onAdd;
        final TransitionAction action;

        StateTransition(boolean onAdd, TransitionAction action) {
            this.onAdd = onAdd;
            this.action = action;
        }
    }

    public void onStateAdded(int bitPosition, TransitionAction action) {
        addTransition(bitPosition, true, action);
    }

    public void onStateRemoved(int bitPosition, TransitionAction action) {
        addTransition(bitPosition, false, action);
    }

    private void addTransition(int bitPosition, boolean onAdd, TransitionAction action) {
        m_transitions.computeIfAbsent(bit(bitPosition), k -> new CopyOnWriteArrayList<>())
            .add(new StateTransition(onAdd, action));
    }

    private void runTransitions(BigInteger triggerBit, boolean isAdd, BigInteger oldState) {
        List<StateTransition> transitions = m_transitions.get(triggerBit);
        if (transitions == null) return;

        BigInteger newState = m_state;
        for (StateTransition transition : transitions) {
            if (transition.onAdd == isAdd) {
                transition.action.onTransition(oldState, newState, triggerBit);
            }
        }
    }

    // ========== Utility Methods ==========

    public String getStateString(Map<Integer, String> positionNames) {
        StringBuilder sb = new StringBuilder();
        sb.append("[");
        boolean first = true;
        for (int i = 0; i < m_state.bitLength(); i++) {
            if (m_state.testBit(i)) {
                if (!first) sb.append(", ");
                String name = positionNames != null ? positionNames.get(i) : null;
                sb.append(name != null ? name : "BIT_" + i);
                first = false;
            }
        }
        sb.append("]");
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("StateMachine[id=%s, state=%s]", m_id, m_state.toString(16));
    }

    public static BigInteger bit(int position) {
        return BigInteger.ONE.shiftLeft(position);
    }
}
