package org.Aayush.wfst.queue;

import it.unimi.dsi.fastutil.ints.Int2ByteOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.wfst.fst.Arc;
import org.Aayush.wfst.fst.ArcFilter;
import org.Aayush.wfst.fst.Fst;

import java.util.List;

/**
 * Topological ranking of the states reachable from a source.
 * <p>
 * Uses an iterative depth-first search (no recursion, so deep chains cannot overflow the
 * stack). Ranks are dense: the source gets rank 0 and every kept arc goes from a lower to a
 * higher rank.
 * </p>
 */
public final class TopologicalOrder {
    public static final int UNRANKED = -1;

    private static final byte WHITE = 0;
    private static final byte GREY = 1;
    private static final byte BLACK = 2;

    private final Int2IntOpenHashMap rankByState;
    private final int size;

    private TopologicalOrder(Int2IntOpenHashMap rankByState) {
        this.rankByState = rankByState;
        this.size = rankByState.size();
    }

    /**
     * Ranks the states reachable from {@code source} through arcs kept by {@code arcFilter}.
     *
     * @return the order, or {@code null} when a cycle is reachable.
     */
    public static <W> TopologicalOrder compute(Fst<W> fst, int source, ArcFilter<W> arcFilter) {
        Int2IntOpenHashMap rankByState = new Int2IntOpenHashMap();
        rankByState.defaultReturnValue(UNRANKED);
        if (source == Fst.NO_STATE) {
            return new TopologicalOrder(rankByState);
        }

        Int2ByteOpenHashMap color = new Int2ByteOpenHashMap();
        color.defaultReturnValue(WHITE);
        IntArrayList finishOrder = new IntArrayList();

        IntArrayList stateStack = new IntArrayList();
        IntArrayList arcCursor = new IntArrayList();
        ObjectArrayList<List<Arc<W>>> arcStack = new ObjectArrayList<>();

        stateStack.add(source);
        arcCursor.add(0);
        arcStack.add(fst.arcs(source));
        color.put(source, GREY);

        while (!stateStack.isEmpty()) {
            int top = stateStack.size() - 1;
            int state = stateStack.getInt(top);
            List<Arc<W>> arcs = arcStack.get(top);
            int cursor = arcCursor.getInt(top);
            if (cursor < arcs.size()) {
                arcCursor.set(top, cursor + 1);
                Arc<W> arc = arcs.get(cursor);
                if (!arcFilter.keep(arc)) {
                    continue;
                }
                int next = arc.nextState();
                byte nextColor = color.get(next);
                if (nextColor == GREY) {
                    return null;
                }
                if (nextColor == WHITE) {
                    color.put(next, GREY);
                    stateStack.add(next);
                    arcCursor.add(0);
                    arcStack.add(fst.arcs(next));
                }
                continue;
            }
            color.put(state, BLACK);
            finishOrder.add(state);
            stateStack.removeInt(top);
            arcCursor.removeInt(top);
            arcStack.remove(top);
        }

        int n = finishOrder.size();
        for (int i = 0; i < n; i++) {
            rankByState.put(finishOrder.getInt(n - 1 - i), i);
        }
        return new TopologicalOrder(rankByState);
    }

    /**
     * @return rank of {@code state}, or {@link #UNRANKED} if it was not reachable.
     */
    public int rank(int state) {
        return rankByState.get(state);
    }

    /**
     * @return number of ranked states.
     */
    public int size() {
        return size;
    }
}
