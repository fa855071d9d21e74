package io.surfworks.modelforge.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PortElements")
class PortElementsTest {

    private Model model;
    private InputNode a;
    private InputNode b;

    @BeforeEach
    void setUp() {
        model = new Model();
        a = model.addNode(new InputNode(PortType.REAL, 4));
        b = model.addNode(new InputNode(PortType.REAL, 3));
    }

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("whole port covers every element")
        void wholePortCoversEveryElement() {
            PortElements elements = PortElements.of(a.output());

            assertEquals(4, elements.size());
            assertEquals(PortType.REAL, elements.type());
            assertEquals(List.of(new PortRange(a.output().address(), 0, 4)), elements.ranges());
        }

        @Test
        @DisplayName("adjacent ranges of the same port are merged")
        void adjacentRangesAreMerged() {
            PortElements pieces = PortElements.concat(List.of(
                    PortElements.of(a.output(), 0, 2),
                    PortElements.of(a.output(), 2, 2)));

            assertEquals(1, pieces.ranges().size());
            assertEquals(PortElements.of(a.output()), pieces);
        }

        @Test
        @DisplayName("ranges of different ports stay separate")
        void rangesOfDifferentPortsStaySeparate() {
            PortElements wiring = PortElements.concat(List.of(
                    PortElements.of(a.output()),
                    PortElements.of(b.output(), 1, 2)));

            assertEquals(6, wiring.size());
            assertEquals(2, wiring.ranges().size());
            assertEquals(List.of(a.output().address(), b.output().address()), List.copyOf(wiring.referencedPorts()));
        }

        @Test
        @DisplayName("rejects ranges outside the port")
        void rejectsRangesOutsideThePort() {
            var e = assertThrows(ModelStructureException.class, () -> PortElements.of(a.output(), 3, 2));
            assertEquals(ModelStructureException.Reason.RANGE_OUT_OF_BOUNDS, e.reason());
        }

        @Test
        @DisplayName("rejects ranges whose end does not fit in an int")
        void rejectsOverflowingRanges() {
            var fromPort = assertThrows(ModelStructureException.class,
                    () -> PortElements.of(a.output(), Integer.MAX_VALUE, 1));
            assertEquals(ModelStructureException.Reason.RANGE_OUT_OF_BOUNDS, fromPort.reason());

            var explicit = assertThrows(ModelStructureException.class,
                    () -> new PortRange(a.output().address(), Integer.MAX_VALUE, 1));
            assertEquals(ModelStructureException.Reason.RANGE_OUT_OF_BOUNDS, explicit.reason());
        }

        @Test
        @DisplayName("rejects concatenation of different value types")
        void rejectsMixedTypes() {
            InputNode ints = model.addNode(new InputNode(PortType.INTEGER, 2));

            var e = assertThrows(ModelStructureException.class, () -> PortElements.concat(List.of(
                    PortElements.of(a.output()), PortElements.of(ints.output()))));
            assertEquals(ModelStructureException.Reason.TYPE_MISMATCH, e.reason());
        }

        @Test
        @DisplayName("equality includes the value type")
        void equalityIncludesType() {
            PortRange range = new PortRange(a.output().address(), 0, 4);

            assertNotEquals(new PortElements(PortType.REAL, List.of(range)),
                    new PortElements(PortType.SMALL_REAL, List.of(range)));
        }
    }

    @Nested
    @DisplayName("Slicing")
    class SlicingTests {

        @Test
        @DisplayName("slice spanning two ports")
        void sliceSpanningTwoPorts() {
            PortElements wiring = PortElements.concat(List.of(PortElements.of(a.output()), PortElements.of(b.output())));

            PortElements middle = wiring.slice(3, 2);

            assertEquals(List.of(
                    new PortRange(a.output().address(), 3, 1),
                    new PortRange(b.output().address(), 0, 1)), middle.ranges());
        }

        @Test
        @DisplayName("full slice returns the same instance")
        void fullSliceReturnsSameInstance() {
            PortElements elements = PortElements.of(a.output());
            assertSame(elements, elements.slice(0, 4));
        }

        @Test
        @DisplayName("rejects slices past the end")
        void rejectsSlicesPastTheEnd() {
            PortElements elements = PortElements.of(b.output());

            var e = assertThrows(ModelStructureException.class, () -> elements.slice(2, 2));
            assertEquals(ModelStructureException.Reason.RANGE_OUT_OF_BOUNDS, e.reason());

            var overflow = assertThrows(ModelStructureException.class, () -> elements.slice(Integer.MAX_VALUE, 1));
            assertEquals(ModelStructureException.Reason.RANGE_OUT_OF_BOUNDS, overflow.reason());
        }
    }
}
