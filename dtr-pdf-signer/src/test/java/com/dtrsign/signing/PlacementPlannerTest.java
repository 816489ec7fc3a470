package com.dtrsign.signing;

import com.dtrsign.TestFixtures;
import com.dtrsign.config.SigningConfig;
import com.dtrsign.pdf.stamp.StampRect;
import com.dtrsign.pdf.stamp.StampSpec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlacementPlannerTest {

    private final PlacementPlanner planner = new PlacementPlanner(SigningConfig.defaults());

    private static SigningRequest.Builder request(SignerRole role) {
        return SigningRequest.builder()
                .pdf(new byte[0])
                .pkcs12(new byte[0])
                .image(TestFixtures.signatureImage())
                .role(role);
    }

    @Test
    void partialMonthDtrSlotsAreShiftedUp() {
        assertEquals(List.of(new StampRect(50f, 355f, 250f, 415f), new StampRect(360f, 355f, 560f, 415f)),
                planner.slots(DocumentKind.DTR, SignerRole.OWNER, false));
        assertEquals(List.of(new StampRect(50f, 325f, 250f, 385f), new StampRect(360f, 325f, 560f, 385f)),
                planner.slots(DocumentKind.DTR, SignerRole.IN_CHARGE, false));
    }

    @Test
    void wholeMonthUsesGridAnchors() {
        List<StampSpec> specs = planner.plan(request(SignerRole.IN_CHARGE).wholeMonth(true).build());
        assertEquals(1, specs.size());
        StampSpec spec = specs.get(0);
        assertEquals(new StampRect(430f, 702f, 540f, 718f), spec.rect());
        assertTrue(spec.isRepeated());
        assertEquals(31, spec.repetition().dayCount());
    }

    @Test
    void leaveApplicationSlots() {
        assertEquals(List.of(new StampRect(330f, 355f, 550f, 425f)),
                planner.slots(DocumentKind.LEAVE_APPLICATION, SignerRole.HEAD, false));
        assertEquals(List.of(new StampRect(200f, 155f, 420f, 225f)),
                planner.slots(DocumentKind.LEAVE_APPLICATION, SignerRole.CAO, false));
    }

    @Test
    void unsupportedCombinationsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> planner.slots(DocumentKind.DTR, SignerRole.SAO, false));
        assertThrows(IllegalArgumentException.class,
                () -> planner.slots(DocumentKind.LEAVE_APPLICATION, SignerRole.IN_CHARGE, false));
        assertThrows(IllegalArgumentException.class,
                () -> planner.slots(DocumentKind.LEAVE_APPLICATION, SignerRole.OWNER, true));
    }

    @Test
    void explicitRectangleAndOverridesWin() {
        StampRect rect = new StampRect(10f, 10f, 110f, 60f);
        List<StampSpec> specs = planner.plan(request(SignerRole.OWNER)
                .rect(rect).page(2).scaleFactor(0.5).imageQuality(80).build());
        assertEquals(1, specs.size());
        StampSpec spec = specs.get(0);
        assertEquals(rect, spec.rect());
        assertEquals(2, spec.page());
        assertEquals(0.5, spec.scaleFactor());
        assertEquals(80, spec.imageQuality());
        assertNull(spec.repetition());
    }

    @Test
    void fieldNamesTakeSmallestFreeNumber() {
        assertEquals("OwnerSignature1", SignerRole.OWNER.nextFieldName(Set.of()));
        assertEquals("OwnerSignature3", SignerRole.OWNER.nextFieldName(Set.of("OwnerSignature1", "OwnerSignature2")));
        assertEquals("InchargeSignature2", SignerRole.IN_CHARGE.nextFieldName(Set.of("InchargeSignature1", "OwnerSignature2")));
        assertEquals("OwnerSignature1", SignerRole.OWNER.nextFieldName(Set.of("OwnerSignature2")));
    }

    @Test
    void rolesParseLeniently() {
        assertEquals(SignerRole.IN_CHARGE, SignerRole.parse("incharge"));
        assertEquals(SignerRole.IN_CHARGE, SignerRole.parse("in-charge"));
        assertEquals(SignerRole.OWNER, SignerRole.parse(" Owner "));
    }
}
