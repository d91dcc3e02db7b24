package com.coxetergroups;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Tests for the matrix predicates and conversions in {@link CoxeterMatrices} and the
 * Cartan matrix constructors in {@link CartanMatrices}.
 */
public class CoxeterMatricesTest {

    @Test
    public void testCoxeterMatrixPredicate() {
        assertTrue(CoxeterMatrices.isCoxeterMatrix(new int[0][0]));
        assertTrue(CoxeterMatrices.isCoxeterMatrix(new int[][] { { 1 } }));
        assertTrue(CoxeterMatrices.isCoxeterMatrix(new int[][] { { 1, 0 }, { 0, 1 } }));
        assertTrue(CoxeterMatrices.isCoxeterMatrix(new int[][] { { 1, 5, 2 }, { 5, 1, 3 }, { 2, 3, 1 } }));

        assertFalse(CoxeterMatrices.isCoxeterMatrix(new int[][] { { 2 } }));
        assertFalse(CoxeterMatrices.isCoxeterMatrix(new int[][] { { 1, 1 }, { 1, 1 } }));
        assertFalse(CoxeterMatrices.isCoxeterMatrix(new int[][] { { 1, 3 }, { 4, 1 } }));
        assertFalse(CoxeterMatrices.isCoxeterMatrix(new int[][] { { 1, -1 }, { -1, 1 } }));
        assertFalse(CoxeterMatrices.isCoxeterMatrix(new int[][] { { 1, 3 } }));
        assertFalse(CoxeterMatrices.isCoxeterMatrix(null));
    }

    @Test
    public void testGcmPredicate() {
        assertTrue(CoxeterMatrices.isGcm(new int[0][0]));
        assertTrue(CoxeterMatrices.isGcm(new int[][] { { 2 } }));
        assertTrue(CoxeterMatrices.isGcm(CartanMatrices.typeG2()));
        assertTrue(CoxeterMatrices.isGcm(new int[][] { { 2, -5 }, { -7, 2 } }));

        assertFalse(CoxeterMatrices.isGcm(new int[][] { { 1 } }));
        assertFalse(CoxeterMatrices.isGcm(new int[][] { { 2, 1 }, { 1, 2 } }));
        // zero pattern must be symmetric
        assertFalse(CoxeterMatrices.isGcm(new int[][] { { 2, -1 }, { 0, 2 } }));
        assertFalse(CoxeterMatrices.isGcm(new int[][] { { 2, -1, 0 }, { -1, 2, -1 } }));
    }

    @Test
    public void testGcmToCoxeterMatrix() {
        assertArrayEquals(new int[][] { { 1, 6 }, { 6, 1 } }, CoxeterMatrices.gcmToCoxeterMatrix(CartanMatrices.typeG2()));
        assertArrayEquals(new int[][] { { 1, 4, 2 }, { 4, 1, 3 }, { 2, 3, 1 } },
                CoxeterMatrices.gcmToCoxeterMatrix(CartanMatrices.typeB(3)));
        // product 4 or more is an infinite bond
        assertArrayEquals(new int[][] { { 1, 0 }, { 0, 1 } },
                CoxeterMatrices.gcmToCoxeterMatrix(new int[][] { { 2, -2 }, { -2, 2 } }));
        assertArrayEquals(new int[][] { { 1, 0 }, { 0, 1 } },
                CoxeterMatrices.gcmToCoxeterMatrix(new int[][] { { 2, -65536 }, { -65536, 2 } }));
        assertArrayEquals(new int[][] { { 1, 0 }, { 0, 1 } },
                CoxeterMatrices.gcmToCoxeterMatrix(new int[][] { { 2, Integer.MIN_VALUE }, { -1, 2 } }));
        assertArrayEquals(new int[0][0], CoxeterMatrices.gcmToCoxeterMatrix(new int[0][0]));
        assertThrows(InvalidMatrixException.class,
                () -> CoxeterMatrices.gcmToCoxeterMatrix(new int[][] { { 1, 3 }, { 3, 1 } }));
    }

    @Test
    public void testCopyIsDeep() {
        int[][] m = { { 1, 3 }, { 3, 1 } };
        int[][] c = CoxeterMatrices.copy(m);
        c[0][1] = 7;
        assertEquals(3, m[0][1]);
    }

    @Test
    public void testFromTypeName() {
        assertArrayEquals(new int[][] { { 1, 3, 2 }, { 3, 1, 3 }, { 2, 3, 1 } }, CoxeterMatrices.fromTypeName("A3"));
        assertArrayEquals(new int[][] { { 1, 5, 2 }, { 5, 1, 3 }, { 2, 3, 1 } }, CoxeterMatrices.fromTypeName("H3"));
        assertArrayEquals(new int[][] { { 1, 7 }, { 7, 1 } }, CoxeterMatrices.fromTypeName("I7"));
        assertArrayEquals(new int[][] { { 1, 0 }, { 0, 1 } }, CoxeterMatrices.fromTypeName("A~1"));
        assertArrayEquals(CoxeterMatrices.fromTypeName("B4"), CoxeterMatrices.fromTypeName(" b4 "));
        assertEquals(0, CoxeterMatrices.fromTypeName("A0").length);

        int[][] e8 = CoxeterMatrices.fromTypeName("E8");
        assertTrue(CoxeterMatrices.isCoxeterMatrix(e8));
        assertEquals(8, e8.length);
    }

    @ParameterizedTest
    @ValueSource(strings = { "A1", "A5", "B3", "C4", "D4", "D6", "E6", "E7", "E8", "F4", "G2", "H2", "H4", "I5",
            "A~2", "B~3", "C~2", "D~4", "E~6", "E~7", "E~8", "F~4", "G~2" })
    public void testTypeNamesGiveCoxeterMatrices(String name) {
        assertTrue(CoxeterMatrices.isCoxeterMatrix(CoxeterMatrices.fromTypeName(name)), name);
    }

    @ParameterizedTest
    @ValueSource(strings = { "X3", "E5", "F3", "G3", "H5", "D3", "B1", "I1", "B~2", "D~3", "A~0", "A", "" })
    public void testBadTypeNames(String name) {
        assertThrows(IllegalArgumentException.class, () -> CoxeterMatrices.fromTypeName(name));
    }

    @Test
    public void testCartanMatrices() {
        assertEquals(0, CartanMatrices.typeA(0).length);
        assertArrayEquals(new int[][] { { 2, -1 }, { -1, 2 } }, CartanMatrices.typeA(2));
        assertEquals(-2, CartanMatrices.typeB(3)[0][1]);
        assertEquals(-2, CartanMatrices.typeC(3)[1][0]);
        assertEquals(-2, CartanMatrices.typeF4()[1][2]);
        assertEquals(-1, CartanMatrices.typeE(6)[2][5]);
        assertArrayEquals(new int[][] { { 2, 0 }, { 0, 2 } }, CartanMatrices.typeD(2));

        for (int[][] gcm : new int[][][] { CartanMatrices.typeA(5), CartanMatrices.typeB(4), CartanMatrices.typeC(4),
                CartanMatrices.typeD(5), CartanMatrices.typeE(7), CartanMatrices.typeF4(), CartanMatrices.typeG2() }) {
            assertTrue(CoxeterMatrices.isGcm(gcm));
        }

        assertThrows(IllegalArgumentException.class, () -> CartanMatrices.typeA(-1));
        assertThrows(IllegalArgumentException.class, () -> CartanMatrices.typeB(1));
        assertThrows(IllegalArgumentException.class, () -> CartanMatrices.typeE(9));
    }

    @Test
    public void testTypeNameMatchesCartanType() {
        assertArrayEquals(CoxeterMatrices.fromTypeName("E6"), CoxeterMatrices.gcmToCoxeterMatrix(CartanMatrices.typeE(6)));
        assertArrayEquals(CoxeterMatrices.fromTypeName("F4"), CoxeterMatrices.gcmToCoxeterMatrix(CartanMatrices.typeF4()));
        assertArrayEquals(CoxeterMatrices.fromTypeName("G2"), CoxeterMatrices.gcmToCoxeterMatrix(CartanMatrices.typeG2()));
    }
}
