package org.Aayush.wfst.queue;

import it.unimi.dsi.fastutil.ints.IntComparator;
import org.Aayush.wfst.fst.AlgebraicPreconditionException;
import org.Aayush.wfst.fst.ArcFilter;
import org.Aayush.wfst.fst.ConstructionException;
import org.Aayush.wfst.fst.VectorFst;
import org.Aayush.wfst.semiring.IntegerSemiring;
import org.Aayush.wfst.semiring.LogSemiring;
import org.Aayush.wfst.testutil.FstFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("State Queue Tests")
class StateQueueTest {

    @Nested
    @DisplayName("1. FIFO and LIFO")
    class SimpleQueueTests {

        @Test
        @DisplayName("FIFO dequeues in arrival order")
        void testFifo() {
            StateQueue queue = new FifoQueue();
            queue.enqueue(3);
            queue.enqueue(1);
            queue.enqueue(2);

            assertEquals(3, queue.head());
            assertEquals(3, queue.dequeue());
            assertEquals(1, queue.dequeue());
            assertEquals(2, queue.dequeue());
            assertTrue(queue.isEmpty());
            assertEquals(QueueType.FIFO, queue.queueType());
        }

        @Test
        @DisplayName("LIFO dequeues most recent first")
        void testLifo() {
            StateQueue queue = new LifoQueue();
            queue.enqueue(3);
            queue.enqueue(1);
            queue.enqueue(2);

            assertEquals(2, queue.dequeue());
            assertEquals(1, queue.dequeue());
            queue.clear();
            assertTrue(queue.isEmpty());
        }

        @Test
        @DisplayName("Empty queues fail with EmptyQueueException")
        void testEmpty() {
            assertThrows(EmptyQueueException.class, () -> new FifoQueue().dequeue());
            assertThrows(EmptyQueueException.class, () -> new LifoQueue().head());
            assertThrows(EmptyQueueException.class, () -> new ShortestFirstQueue(Integer::compare).dequeue());
        }
    }

    @Nested
    @DisplayName("2. Shortest-first")
    class ShortestFirstTests {

        @Test
        @DisplayName("Dequeues by key and supports decrease-key")
        void testDecreaseKey() {
            double[] key = {5.0d, 3.0d, 8.0d, 1.0d, 9.0d};
            IntComparator byKey = (a, b) -> Double.compare(key[a], key[b]);
            ShortestFirstQueue queue = new ShortestFirstQueue(byKey);
            for (int s = 0; s < key.length; s++) {
                queue.enqueue(s);
            }

            key[4] = 0.5d;
            queue.update(4);
            queue.enqueue(4);

            assertEquals(5, queue.size());
            int[] order = new int[5];
            for (int i = 0; i < order.length; i++) {
                order[i] = queue.dequeue();
            }
            assertArrayEquals(new int[]{4, 3, 1, 0, 2}, order);
        }

        @Test
        @DisplayName("Clear forgets pending states")
        void testClearThenReuse() {
            ShortestFirstQueue queue = new ShortestFirstQueue(Integer::compare);
            queue.enqueue(7);
            queue.enqueue(2);
            queue.clear();
            queue.enqueue(7);

            assertEquals(1, queue.size());
            assertEquals(7, queue.dequeue());
        }

        @Test
        @DisplayName("Factory rejects non-idempotent semirings")
        void testFactoryPrecondition() {
            VectorFst<Long> fst = FstFixtures.countingTriangle();
            StateQueueFactory<Long> factory = StateQueues.shortestFirst();

            assertThrows(
                    AlgebraicPreconditionException.class,
                    () -> factory.create(fst, 0, ArcFilter.acceptAll(), Integer::compare)
            );
        }
    }

    @Nested
    @DisplayName("3. Topological order")
    class TopOrderTests {

        @Test
        @DisplayName("Ranks follow the arcs of an acyclic automaton")
        void testRanks() {
            TopologicalOrder order = TopologicalOrder.compute(FstFixtures.countingTriangle(), 0, ArcFilter.acceptAll());

            assertNotNull(order);
            assertEquals(3, order.size());
            assertEquals(0, order.rank(0));
            assertTrue(order.rank(1) < order.rank(2));
            assertEquals(TopologicalOrder.UNRANKED, order.rank(99));
        }

        @Test
        @DisplayName("Cycles are detected, unless the arc filter breaks them")
        void testCycle() {
            VectorFst<Double> cycle = FstFixtures.tropicalCycle();

            assertNull(TopologicalOrder.compute(cycle, 0, ArcFilter.acceptAll()));
            assertNotNull(TopologicalOrder.compute(cycle, 0, arc -> arc.nextState() != 0));
        }

        @Test
        @DisplayName("Queue releases states in rank order regardless of arrival")
        void testTopOrderQueue() {
            TopologicalOrder order = TopologicalOrder.compute(FstFixtures.countingTriangle(), 0, ArcFilter.acceptAll());
            TopOrderQueue queue = new TopOrderQueue(order);
            queue.enqueue(2);
            queue.enqueue(0);
            queue.enqueue(1);

            int[] dequeued = {queue.dequeue(), queue.dequeue(), queue.dequeue()};
            assertArrayEquals(new int[]{0, 1, 2}, dequeued);
            assertTrue(queue.isEmpty());
            assertThrows(EmptyQueueException.class, queue::head);
        }

        @Test
        @DisplayName("Factory rejects cyclic automata")
        void testFactoryRejectsCycle() {
            StateQueueFactory<Double> factory = StateQueues.topOrder();

            assertThrows(
                    ConstructionException.class,
                    () -> factory.create(FstFixtures.tropicalCycle(), 0, ArcFilter.acceptAll(), Integer::compare)
            );
        }
    }

    @Nested
    @DisplayName("4. Automatic selection")
    class AutoQueueTests {

        @Test
        @DisplayName("Acyclic automaton selects topological order")
        void testAcyclic() {
            AutoQueue queue = new AutoQueue(FstFixtures.countingTriangle(), 0, ArcFilter.acceptAll(), Integer::compare);

            assertEquals(QueueType.TOP_ORDER, queue.selectedType());
            assertEquals(QueueType.AUTO, queue.queueType());
        }

        @Test
        @DisplayName("Cyclic tropical automaton selects shortest-first")
        void testCyclicTropical() {
            AutoQueue queue = new AutoQueue(FstFixtures.tropicalCycle(), 0, ArcFilter.acceptAll(), Integer::compare);

            assertEquals(QueueType.SHORTEST_FIRST, queue.selectedType());
        }

        @Test
        @DisplayName("Cyclic automaton over a non-idempotent semiring falls back to FIFO")
        void testCyclicLog() {
            VectorFst<Double> fst = new VectorFst<>(LogSemiring.INSTANCE);
            fst.addState();
            fst.addState();
            fst.setStart(0);
            fst.addArc(0, 1, 1, 1.0d, 1);
            fst.addArc(1, 1, 1, 1.0d, 0);

            AutoQueue queue = new AutoQueue(fst, 0, ArcFilter.acceptAll(), Integer::compare);

            assertEquals(QueueType.FIFO, queue.selectedType());
        }

        @Test
        @DisplayName("forType covers every discipline")
        void testForType() {
            VectorFst<Long> fst = FstFixtures.countingTriangle();
            for (QueueType type : Arrays.asList(QueueType.FIFO, QueueType.LIFO, QueueType.TOP_ORDER, QueueType.AUTO)) {
                StateQueue queue = StateQueues.<Long>forType(type).create(fst, 0, ArcFilter.acceptAll(), Integer::compare);
                assertEquals(type, queue.queueType());
            }
            VectorFst<Long> counting = new VectorFst<>(IntegerSemiring.INSTANCE);
            assertThrows(AlgebraicPreconditionException.class,
                    () -> StateQueues.<Long>forType(QueueType.SHORTEST_FIRST)
                            .create(counting, 0, ArcFilter.acceptAll(), Integer::compare));
        }
    }
}
