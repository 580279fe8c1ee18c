package com.largomodo.boxpicker.core.domain;

import com.largomodo.boxpicker.core.BoxCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GreedyBoxPackerTest {

    private GreedyBoxPacker packer;
    private GreedyBoxPacker shelfPacker;

    @BeforeEach
    void setUp() {
        packer = new GreedyBoxPacker(BoxCatalog.standard(), new PerItemFitStrategy());
        shelfPacker = new GreedyBoxPacker(BoxCatalog.standard(), new ShelfFitStrategy());
    }

    @Test
    void testSingleItemSmallestBox() {
        // 6x4x4 sorted [4,4,6] fits BX-S sorted [4,6,8]
        PackingResult result = packer.pack(List.of(new Item("A", 6, 4, 4, 0)));

        assertTrue(result.isPacked());
        assertEquals(1, result.boxCount(), "Should use exactly 1 box");
        assertEquals("BX-S", result.assignments().get(0).box().id());
        assertEquals(List.of("A"), result.assignments().get(0).skus());
    }

    @Test
    void testTwoItemsShareSmallestBox() {
        // Second item's 8 equals the box's longest axis: inclusive bound, still fits
        PackingResult result = packer.pack(List.of(
                new Item("A", 6, 4, 4, 0),
                new Item("B", 8, 4, 4, 1)
        ));

        assertEquals(1, result.boxCount());
        assertEquals("BX-S", result.assignments().get(0).box().id());
        assertEquals(List.of("A", "B"), result.assignments().get(0).skus());
    }

    @Test
    void testPerItemRuleIgnoresCombinedVolume() {
        // Three 20x15x10 items (9000 total) cannot physically share BX-XL (3840),
        // but each fits it alone ([10,15,20] <= [12,16,20]) so the per-item rule packs them together
        PackingResult result = packer.pack(List.of(
                new Item("C1", 20, 15, 10, 0),
                new Item("C2", 20, 15, 10, 1),
                new Item("C3", 20, 15, 10, 2)
        ));

        assertEquals(1, result.boxCount(), "Per-item rule should not split the items");
        assertEquals("BX-XL", result.assignments().get(0).box().id(),
                "BX-XL is the first box every item fits individually");
        assertEquals(List.of("C1", "C2", "C3"), result.assignments().get(0).skus());
    }

    @Test
    void testShelfRuleSplitsItemsThatCannotBeLaidOut() {
        // Shelf layout: after one 20x15x10 item neither a row, a second row nor a second layer
        // has room in BX-XL; BX-XXL takes two layers but not a third item
        PackingResult result = shelfPacker.pack(List.of(
                new Item("C1", 20, 15, 10, 0),
                new Item("C2", 20, 15, 10, 1),
                new Item("C3", 20, 15, 10, 2)
        ));

        assertTrue(result.isPacked());
        assertEquals(3, result.boxCount(), "Each item should get its own box");
        for (int i = 0; i < 3; i++) {
            assertEquals("BX-XL", result.assignments().get(i).box().id());
            assertEquals(List.of("C" + (i + 1)), result.assignments().get(i).skus(),
                    "Equal volumes keep request order");
        }
    }

    @Test
    void testOversizedItemReported() {
        PackingResult result = packer.pack(List.of(new Item("HUGE", 100, 100, 100, 0)));

        assertEquals(PackingResult.Outcome.ITEM_TOO_LARGE, result.outcome());
        assertTrue(result.assignments().isEmpty(), "Nothing should be packed");
        assertEquals(1, result.oversizedItems().size());

        OversizedItem oversized = result.oversizedItems().get(0);
        assertEquals("HUGE", oversized.sku());
        assertEquals(new Dimensions(100, 100, 100), oversized.dimensions());
        assertEquals(new Dimensions(24, 20, 20), oversized.maxBoxDimensions());
    }

    @Test
    void testRotationSelectsMediumBox() {
        // [3,3,10] fails BX-S [4,6,8] on the long axis, fits BX-M [6,10,12]
        PackingResult result = packer.pack(List.of(new Item("ROD", 10, 3, 3, 0)));

        assertEquals(1, result.boxCount());
        assertEquals("BX-M", result.assignments().get(0).box().id());
    }

    @Test
    void testAllOversizedItemsListed() {
        PackingResult result = packer.pack(List.of(
                new Item("ok", 1, 1, 1, 0),
                new Item("long", 25, 1, 1, 1),     // 25 > 24
                new Item("exact", 20, 24, 20, 2),  // exactly BX-XXL, rotated
                new Item("wide", 21, 21, 1, 3)     // second axis 21 > 20
        ));

        assertEquals(PackingResult.Outcome.ITEM_TOO_LARGE, result.outcome());
        List<String> skus = result.oversizedItems().stream().map(OversizedItem::sku).toList();
        assertEquals(List.of("long", "wide"), skus, "Every offender listed, in request order");
    }

    @Test
    void testShelfRuleOpensBoxesInOrderAndKeepsThem() {
        // Two items filling BX-XL exactly, plus a tiny item that arrives first in the request
        PackingResult result = shelfPacker.pack(List.of(
                new Item("tiny", 2, 2, 2, 0),
                new Item("a", 20, 16, 12, 1),
                new Item("b", 20, 16, 12, 2)
        ));

        assertEquals(3, result.boxCount());
        // Emitted in opening order: largest items first, then the box opened for the tiny item
        assertEquals("BX-XL", result.assignments().get(0).box().id());
        assertEquals(List.of("a"), result.assignments().get(0).skus());
        assertEquals("BX-XL", result.assignments().get(1).box().id());
        assertEquals(List.of("b"), result.assignments().get(1).skus());
        assertEquals("BX-S", result.assignments().get(2).box().id());
        assertEquals(List.of("tiny"), result.assignments().get(2).skus());
    }

    @Test
    void testShelfRuleStacksCubesInLargerBox() {
        // Three 8-cubes: per-item fits BX-L, but its 16x12x8 interior holds only two in a row
        List<Item> cubes = List.of(
                new Item("a", 8, 8, 8, 0),
                new Item("b", 8, 8, 8, 1),
                new Item("c", 8, 8, 8, 2)
        );

        assertEquals("BX-L", packer.pack(cubes).assignments().get(0).box().id());

        PackingResult shelf = shelfPacker.pack(cubes);
        assertEquals(1, shelf.boxCount(), "BX-XL fits a second row");
        assertEquals("BX-XL", shelf.assignments().get(0).box().id());
    }

    @Test
    void testGreedyJoinsExistingBoxBeforeOpening() {
        // Descending volume: cube (729) opens BX-XL, flat (480) only fits BX-XXL, tiny joins BX-XL
        PackingResult result = packer.packIntoBoxes(List.of(
                new Item("cube", 9, 9, 9, 0),
                new Item("flat", 24, 20, 1, 1),
                new Item("tiny", 1, 1, 1, 2)
        ));

        assertEquals(2, result.boxCount(), "Tiny item should not open a third box");
        assertEquals("BX-XL", result.assignments().get(0).box().id());
        assertEquals(List.of("cube", "tiny"), result.assignments().get(0).skus());
        assertEquals("BX-XXL", result.assignments().get(1).box().id());
        assertEquals(List.of("flat"), result.assignments().get(1).skus());
    }

    @Test
    void testGreedyPrefersSmallerOpenBoxOverEarlierOne() {
        // LONG (120) ranks before CUBE (125) but is opened second.
        // Called directly: CUBE is the largest box by volume, so the oversize check would reject the rod
        BoxCatalog catalog = new BoxCatalog(List.of(
                new BoxDefinition("CUBE", 5, 5, 5),
                new BoxDefinition("LONG", 30, 2, 2)
        ));
        GreedyBoxPacker custom = new GreedyBoxPacker(catalog, new PerItemFitStrategy());

        PackingResult result = custom.packIntoBoxes(List.of(
                new Item("c", 5, 5, 5, 0),
                new Item("r", 30, 2, 2, 1),
                new Item("t", 1, 1, 1, 2)
        ));

        assertEquals(2, result.boxCount());
        assertEquals("CUBE", result.assignments().get(0).box().id(), "Opened first, emitted first");
        assertEquals(List.of("c"), result.assignments().get(0).skus());
        assertEquals("LONG", result.assignments().get(1).box().id());
        assertEquals(List.of("r", "t"), result.assignments().get(1).skus(),
                "Tiny item goes to the smallest open box, not the first opened");
    }

    @Test
    void testPackingErrorWhenNoBoxFitsDuringGreedy() {
        // Bypasses the oversize check to exercise the fallback result
        PackingResult result = packer.packIntoBoxes(List.of(new Item("HUGE", 30, 30, 30, 0)));

        assertEquals(PackingResult.Outcome.PACKING_ERROR, result.outcome());
        assertEquals("Item 'HUGE' does not fit in any available box.", result.failureMessage());
    }

    @Test
    void testSkusListedInRequestOrderWithinBox() {
        PackingResult result = packer.pack(List.of(
                new Item("small", 1, 1, 1, 0),
                new Item("large", 6, 4, 4, 1),
                new Item("medium", 2, 2, 2, 2)
        ));

        assertEquals(List.of("small", "large", "medium"), result.assignments().get(0).skus());
    }

    @Test
    void testIdenticalInputGivesIdenticalResult() {
        List<Item> items = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            items.add(new Item("sku-" + i, 4 + i, 3 + (i % 4), 2 + (i % 3), i));
        }

        assertEquals(shelfPacker.pack(items), shelfPacker.pack(items));
        assertEquals(packer.pack(items), packer.pack(items));
    }

    @Test
    void testEmptyInput() {
        PackingResult result = packer.pack(new ArrayList<>());

        assertTrue(result.isPacked());
        assertTrue(result.assignments().isEmpty(), "Empty input should need no boxes");
    }

    @Test
    void testNullInputThrowsException() {
        assertThrows(IllegalArgumentException.class,
                () -> packer.pack(null),
                "Should throw IllegalArgumentException for null input");
    }

    @Test
    void testConstructorRejectsNullCollaborators() {
        assertThrows(IllegalArgumentException.class,
                () -> new GreedyBoxPacker(null, new PerItemFitStrategy()));
        assertThrows(IllegalArgumentException.class,
                () -> new GreedyBoxPacker(BoxCatalog.standard(), null));
    }
}
