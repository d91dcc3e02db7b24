package com.coxetergroups;

import static org.junit.jupiter.api.Assertions.*;

import java.util.OptionalInt;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Tests for the two reflection table builders. Reference tables for H3, H4 and the infinite
 * group with Coxeter diagram 3-5-3 are known results; the crystallographic types are cross-checked
 * between the two builders.
 */
public class ReflectionTableBuilderTest {

    static final int[][] H3 = { { 1, 5, 2 }, { 5, 1, 3 }, { 2, 3, 1 } };
    static final int[][] H4 = { { 1, 5, 2, 2 }, { 5, 1, 3, 2 }, { 2, 3, 1, 3 }, { 2, 2, 3, 1 } };
    static final int[][] G353 = { { 1, 3, 2, 2 }, { 3, 1, 5, 2 }, { 2, 5, 1, 3 }, { 2, 2, 3, 1 } };

    private static final int[][] H3_TABLE = {
            { 0, 5, 3, 7, 2, 9, 4, 10, 6, 8, 13, 14, 11, 12, 15 },
            { 4, 0, 6, 1, 7, 3, 5, 8, 11, 12, 9, 10, 13, 15, 14 },
            { 1, 6, 0, 8, 9, 2, 10, 4, 5, 7, 12, 11, 14, 13, 15 },
    };

    private static final int[][] H4_TABLE = {
            { 0, 6, 3, 4, 9, 2, 11, 8, 5, 13, 7, 16, 10, 18, 19, 12, 21, 14, 15, 23, 17, 26, 20, 28, 25, 22, 30, 24, 29, 27,
                    34, 32, 36, 31, 38, 33, 37, 35, 39, 40, 44, 42, 43, 41, 47, 46, 45, 50, 51, 48, 49, 53, 52, 55, 54, 57, 56, 58, 59, 60 },
            { 5, 0, 7, 4, 1, 9, 3, 12, 6, 10, 15, 8, 17, 14, 11, 20, 13, 22, 19, 16, 25, 18, 23, 24, 21, 29, 27, 31, 26, 33,
                    28, 35, 30, 37, 32, 39, 34, 41, 36, 40, 38, 45, 43, 44, 42, 48, 49, 46, 47, 52, 51, 50, 53, 54, 56, 55, 58, 57, 59, 60 },
            { 1, 7, 0, 8, 10, 11, 2, 4, 13, 5, 6, 12, 9, 14, 17, 16, 15, 18, 21, 24, 19, 27, 28, 20, 25, 30, 22, 23, 32, 26,
                    31, 29, 35, 34, 33, 38, 40, 36, 42, 37, 45, 39, 46, 47, 41, 43, 44, 48, 49, 50, 51, 54, 55, 52, 53, 56, 57, 59, 58, 60 },
            { 1, 2, 8, 0, 5, 6, 12, 3, 9, 14, 16, 7, 18, 10, 20, 11, 22, 13, 23, 15, 26, 17, 19, 27, 29, 21, 24, 30, 25, 28,
                    33, 32, 31, 36, 35, 34, 39, 38, 37, 43, 41, 46, 40, 44, 48, 42, 50, 45, 52, 47, 53, 49, 51, 54, 55, 56, 57, 58, 60, 59 },
    };

    private static final int[][] G353_TABLE = {
            { 0, 5, 3, 4, 2, 9, 12, 8, 6, 16, 15, 7, 18, 20, 11, 10, 23, 13, 25, 14, 27, 28, 17, 29, 19, 0, 21, 22, 24, 0, 31, 0 },
            { 5, 0, 7, 4, 1, 10, 3, 13, 14, 6, 17, 12, 8, 9, 22, 20, 11, 18, 26, 16, 21, 15, 28, 30, 0, 19, 31, 23, 0, 24, 27, 32 },
            { 1, 6, 0, 8, 9, 2, 10, 4, 5, 7, 11, 16, 19, 21, 15, 12, 24, 25, 13, 27, 14, 0, 29, 17, 18, 26, 20, 0, 23, 32, 31, 30 },
            { 1, 2, 8, 0, 5, 11, 13, 3, 15, 17, 6, 18, 7, 22, 9, 23, 10, 12, 24, 28, 0, 14, 16, 19, 29, 30, 0, 20, 25, 26, 0, 32 },
    };

    @Test
    public void testH3ReferenceTable() {
        ReflectionTable t = new CoxeterReflectionTableBuilder(H3).build();
        assertArrayEquals(H3_TABLE, t.toArray());
        assertEquals(15, t.rootCount());
        assertTrue(t.describesFiniteGroup());
    }

    @Test
    public void testH4ReferenceTable() {
        CoxeterReflectionTableBuilder builder = new CoxeterReflectionTableBuilder(H4);
        ReflectionTable t = builder.build();
        assertArrayEquals(H4_TABLE, t.toArray());
        assertEquals(4, t.zeroCount());
        assertEquals(60, builder.getLastStats().minimalRoots);
        assertEquals(0, builder.getLastStats().lockedPairs);
    }

    @Test
    public void testHyperbolic353ReferenceTable() {
        CoxeterReflectionTableBuilder builder = new CoxeterReflectionTableBuilder(G353);
        ReflectionTable t = builder.build();
        assertArrayEquals(G353_TABLE, t.toArray());
        assertFalse(t.describesFiniteGroup());
        assertEquals(t.zeroCount() - t.rank(), builder.getLastStats().lockedPairs);
    }

    @Test
    public void testInfiniteDihedral() {
        ReflectionTable t = new CoxeterReflectionTableBuilder(new int[][] { { 1, 0 }, { 0, 1 } }).build();
        assertArrayEquals(new int[][] { { 0, 0 }, { 0, 0 } }, t.toArray());
        assertFalse(t.describesFiniteGroup());

        ReflectionTable g = new GcmReflectionTableBuilder(new int[][] { { 2, -2 }, { -2, 2 } }).build();
        assertEquals(t, g);
    }

    @Test
    public void testAffineA2() {
        GcmReflectionTableBuilder builder = new GcmReflectionTableBuilder(new int[][] { { 2, -1, -1 }, { -1, 2, -1 }, { -1, -1, 2 } });
        ReflectionTable t = builder.build();
        assertEquals(6, t.rootCount());
        assertEquals(6, t.zeroCount());
        assertFalse(t.describesFiniteGroup());
        assertEquals(3, builder.getLastStats().lockedPairs);
        assertEquals(2, builder.getLastStats().maxDepth);

        ReflectionTable general = new CoxeterReflectionTableBuilder(CoxeterMatrices.fromTypeName("A~2")).build();
        assertEquals(t, general);
    }

    @Test
    public void testLargeGcmEntries() {
        // 65536 * 65536 wraps to 0 as an int
        int[][] gcm = { { 2, -65536 }, { -65536, 2 } };
        GcmReflectionTableBuilder builder = new GcmReflectionTableBuilder(gcm);
        ReflectionTable t = builder.build();
        assertEquals(2, t.rootCount());
        assertEquals(4, t.zeroCount());
        assertEquals(2, builder.getLastStats().lockedPairs);
        assertEquals(new CoxeterReflectionTableBuilder(new int[][] { { 1, 0 }, { 0, 1 } }).build(), t);

        int[][] branched = { { 2, -65536, 0 }, { -65536, 2, -1 }, { 0, -1, 2 } };
        ReflectionTable b = new GcmReflectionTableBuilder(branched).build();
        assertArrayEquals(new int[][] { { 0, 0, 3, 0 }, { 0, 0, 4, 3 }, { 1, 4, 0, 2 } }, b.toArray());
        assertEquals(new CoxeterReflectionTableBuilder(new int[][] { { 1, 0, 2 }, { 0, 1, 3 }, { 2, 3, 1 } }).build(), b);

        MinimalRootGroup g = MinimalRootGroup.create(gcm);
        assertFalse(g.isFinite());
        assertEquals(0, g.coxeterMatrix()[0][1]);
        assertEquals(8, g.element(1, 2).power(4).length());
    }

    @Test
    public void testProductAtLeastFour() {
        assertTrue(GcmReflectionTableBuilder.productAtLeastFour(-2, -2));
        assertTrue(GcmReflectionTableBuilder.productAtLeastFour(4, 1));
        assertTrue(GcmReflectionTableBuilder.productAtLeastFour(-65536L * 65536, -65536L * 65536));
        assertTrue(GcmReflectionTableBuilder.productAtLeastFour(Long.MIN_VALUE + 1, -1));
        assertFalse(GcmReflectionTableBuilder.productAtLeastFour(-1, -3));
        assertFalse(GcmReflectionTableBuilder.productAtLeastFour(0, -65536));
        assertFalse(GcmReflectionTableBuilder.productAtLeastFour(-65536, 65536));
    }

    @Test
    public void testRankZeroAndOne() {
        ReflectionTable empty = new CoxeterReflectionTableBuilder(new int[0][0]).build();
        assertEquals(0, empty.rootCount());
        assertTrue(empty.describesFiniteGroup());

        ReflectionTable a1 = new GcmReflectionTableBuilder(new int[][] { { 2 } }).build();
        assertArrayEquals(new int[][] { { 0 } }, a1.toArray());
        assertEquals(a1, new CoxeterReflectionTableBuilder(new int[][] { { 1 } }).build());
    }

    static Stream<Arguments> crystallographicTypes() {
        Stream.Builder<Arguments> b = Stream.builder();
        for (int r = 0; r <= 8; r++) b.add(Arguments.of("A" + r, CartanMatrices.typeA(r)));
        for (int r = 2; r <= 8; r++) {
            b.add(Arguments.of("B" + r, CartanMatrices.typeB(r)));
            b.add(Arguments.of("C" + r, CartanMatrices.typeC(r)));
            b.add(Arguments.of("D" + r, CartanMatrices.typeD(r)));
        }
        for (int r = 6; r <= 8; r++) b.add(Arguments.of("E" + r, CartanMatrices.typeE(r)));
        b.add(Arguments.of("F4", CartanMatrices.typeF4()));
        b.add(Arguments.of("G2", CartanMatrices.typeG2()));
        return b.build();
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("crystallographicTypes")
    public void testBuildersAgree(String name, int[][] gcm) {
        ReflectionTable crystallographic = new GcmReflectionTableBuilder(gcm).build();
        ReflectionTable general = new CoxeterReflectionTableBuilder(CoxeterMatrices.gcmToCoxeterMatrix(gcm)).build();
        assertEquals(crystallographic, general, name);
        assertTrue(general.describesFiniteGroup(), name);
    }

    @Test
    public void testKnownRootCounts() {
        // finite types have exactly as many minimal roots as positive roots
        assertEquals(36, new GcmReflectionTableBuilder(CartanMatrices.typeE(6)).build().rootCount());
        assertEquals(120, new GcmReflectionTableBuilder(CartanMatrices.typeE(8)).build().rootCount());
        assertEquals(24, new GcmReflectionTableBuilder(CartanMatrices.typeF4()).build().rootCount());
        assertEquals(6, new GcmReflectionTableBuilder(CartanMatrices.typeG2()).build().rootCount());
    }

    @Test
    public void testTableIsAnInvolutionOnRoots() {
        ReflectionTable[] tables = {
                new CoxeterReflectionTableBuilder(G353).build(),
                new GcmReflectionTableBuilder(CartanMatrices.typeE(7)).build(),
                new GcmReflectionTableBuilder(new int[][] { { 2, -1, -1 }, { -1, 2, -1 }, { -1, -1, 2 } }).build(),
        };
        for (ReflectionTable t : tables) assertInvolution(t);
    }

    /** Each generator maps minimal roots in pairs: s(a) = b iff s(b) = a. */
    static void assertInvolution(ReflectionTable t) {
        for (int s = 1; s <= t.rank(); s++) {
            for (int root = 1; root <= t.rootCount(); root++) {
                OptionalInt image = t.reflect(s, root);
                if (image.isPresent()) {
                    assertEquals(root, t.reflect(s, image.getAsInt()).getAsInt());
                }
            }
        }
    }

    @Test
    public void testReflectRangeChecks() {
        ReflectionTable t = new CoxeterReflectionTableBuilder(H3).build();
        assertFalse(t.reflect(1, 1).isPresent());
        assertEquals(5, t.reflect(1, 2).getAsInt());
        assertThrows(GeneratorOutOfRangeException.class, () -> t.reflect(0, 1));
        assertThrows(GeneratorOutOfRangeException.class, () -> t.reflect(4, 1));
        assertThrows(IndexOutOfBoundsException.class, () -> t.reflect(1, 16));
    }

    @Test
    public void testBuildersRejectWrongMatrixKind() {
        assertThrows(InvalidMatrixException.class, () -> new GcmReflectionTableBuilder(H3));
        assertThrows(InvalidMatrixException.class, () -> new CoxeterReflectionTableBuilder(CartanMatrices.typeA(3)));
    }

    @Test
    public void testStatsAndToString() {
        GcmReflectionTableBuilder builder = new GcmReflectionTableBuilder(CartanMatrices.typeA(3));
        assertNull(builder.getLastStats());
        ReflectionTable t = builder.build();
        TableStats stats = builder.getLastStats();
        assertEquals(6, stats.minimalRoots);
        assertEquals(3, stats.maxDepth);
        assertEquals("*Totals: minimal_roots=6 locked_pairs=0 max_root_depth=3", stats.toString());
        assertEquals(3, t.toString().split(System.lineSeparator()).length);
    }

    @Test
    public void testTableSelection() {
        assertEquals(new GcmReflectionTableBuilder(CartanMatrices.typeB(3)).build(),
                ReflectionTables.build(CartanMatrices.typeB(3), GroupOptions.TableAlgorithm.GENERAL));
        assertEquals(new CoxeterReflectionTableBuilder(H3).build(),
                ReflectionTables.build(H3, GroupOptions.TableAlgorithm.AUTO));
        assertThrows(InvalidMatrixException.class,
                () -> ReflectionTables.build(H3, GroupOptions.TableAlgorithm.CRYSTALLOGRAPHIC));
        assertThrows(InvalidMatrixException.class,
                () -> ReflectionTables.build(new int[][] { { 3 } }, GroupOptions.TableAlgorithm.AUTO));
    }
}
