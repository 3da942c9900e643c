package org.Aayush.wfst.queue;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.wfst.fst.Fst;

import java.util.Objects;

/**
 * Discipline that dequeues states in topological order. Valid only for acyclic automata:
 * every state is dequeued after all of its predecessors, so each state is visited once.
 */
public final class TopOrderQueue implements StateQueue {

    private final TopologicalOrder order;
    // stateByRank[rank] = pending state, NO_STATE when empty
    private final IntArrayList stateByRank;
    private int front;
    private int back = -1;

    public TopOrderQueue(TopologicalOrder order) {
        this.order = Objects.requireNonNull(order, "order");
        this.stateByRank = new IntArrayList(order.size());
        for (int i = 0; i < order.size(); i++) {
            stateByRank.add(Fst.NO_STATE);
        }
    }

    @Override
    public int head() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        return stateByRank.getInt(front);
    }

    @Override
    public void enqueue(int state) {
        int rank = order.rank(state);
        if (rank == TopologicalOrder.UNRANKED) {
            throw new IllegalArgumentException("state " + state + " has no topological rank");
        }
        if (isEmpty()) {
            front = rank;
            back = rank;
        } else if (rank > back) {
            back = rank;
        } else if (rank < front) {
            front = rank;
        }
        stateByRank.set(rank, state);
    }

    @Override
    public int dequeue() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        int state = stateByRank.getInt(front);
        stateByRank.set(front, Fst.NO_STATE);
        front++;
        while (front <= back && stateByRank.getInt(front) == Fst.NO_STATE) {
            front++;
        }
        return state;
    }

    @Override
    public void update(int state) {
        // rank is fixed by topology
    }

    @Override
    public boolean isEmpty() {
        return front > back;
    }

    @Override
    public void clear() {
        for (int i = Math.max(front, 0); i <= back; i++) {
            stateByRank.set(i, Fst.NO_STATE);
        }
        front = 0;
        back = -1;
    }

    @Override
    public QueueType queueType() {
        return QueueType.TOP_ORDER;
    }
}
