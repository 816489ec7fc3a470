package com.dtrsign.signing;

import com.dtrsign.config.SigningConfig;
import com.dtrsign.pdf.stamp.RepetitionRule;
import com.dtrsign.pdf.stamp.StampRect;
import com.dtrsign.pdf.stamp.StampSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fixed signature slots of the supported forms. Each returned spec becomes one signature field.
 * <p>
 * A DTR page carries two copies of the record side by side, so a signer gets one field per copy. Forms
 * covering part of a month are laid out higher on the page than whole-month forms; in whole-month mode a
 * single field stamps every day cell of the grid instead.
 */
public final class PlacementPlanner {

    static final float OWNER_PARTIAL_MONTH_SHIFT = 250f;
    static final float IN_CHARGE_PARTIAL_MONTH_SHIFT = 255f;

    private static final List<StampRect> DTR_OWNER_SLOTS = List.of(
            new StampRect(50f, 105f, 250f, 165f),
            new StampRect(360f, 105f, 560f, 165f));
    private static final List<StampRect> DTR_IN_CHARGE_SLOTS = List.of(
            new StampRect(50f, 70f, 250f, 130f),
            new StampRect(360f, 70f, 560f, 130f));

    private static final Map<SignerRole, StampRect> LEAVE_SLOTS = Map.of(
            SignerRole.OWNER, new StampRect(330f, 535f, 550f, 605f),
            SignerRole.HEAD, new StampRect(330f, 355f, 550f, 425f),
            SignerRole.SAO, new StampRect(50f, 355f, 270f, 425f),
            SignerRole.CAO, new StampRect(200f, 155f, 420f, 225f));

    private final SigningConfig config;

    public PlacementPlanner(SigningConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public List<StampSpec> plan(SigningRequest request) {
        Objects.requireNonNull(request, "request");
        double scale = request.scaleFactor() != null ? request.scaleFactor() : config.getScaleFactor();
        int quality = request.imageQuality() != null ? request.imageQuality() : config.getImageQuality();
        RepetitionRule repetition = null;
        if (request.wholeMonth()) {
            int days = request.dayCount() != null ? request.dayCount() : config.getDefaultDayCount();
            repetition = new RepetitionRule(days, config.getGrid());
        }

        List<StampRect> rects = request.rect() != null
                ? List.of(request.rect())
                : slots(request.kind(), request.role(), request.wholeMonth());
        List<StampSpec> specs = new ArrayList<>(rects.size());
        for (StampRect rect : rects) {
            specs.add(new StampSpec(request.image(), request.page(), rect, scale, quality, repetition));
        }
        return specs;
    }

    List<StampRect> slots(DocumentKind kind, SignerRole role, boolean wholeMonth) {
        switch (kind) {
            case DTR:
                return dtrSlots(role, wholeMonth);
            case LEAVE_APPLICATION:
                if (wholeMonth) {
                    throw new IllegalArgumentException("Whole-month signing only applies to DTR documents");
                }
                StampRect slot = LEAVE_SLOTS.get(role);
                if (slot == null) {
                    throw new IllegalArgumentException("Leave applications have no " + role + " signature slot");
                }
                return List.of(slot);
            default:
                throw new IllegalArgumentException("Unsupported document kind: " + kind);
        }
    }

    private List<StampRect> dtrSlots(SignerRole role, boolean wholeMonth) {
        List<StampRect> base;
        float shift;
        switch (role) {
            case OWNER:
                base = DTR_OWNER_SLOTS;
                shift = OWNER_PARTIAL_MONTH_SHIFT;
                break;
            case IN_CHARGE:
                base = DTR_IN_CHARGE_SLOTS;
                shift = IN_CHARGE_PARTIAL_MONTH_SHIFT;
                break;
            default:
                throw new IllegalArgumentException("DTR documents have no " + role + " signature slot");
        }
        if (wholeMonth) {
            StampRect anchor = config.getGridAnchor(role.configKey());
            if (anchor == null) {
                throw new IllegalArgumentException("No whole-month grid anchor configured for " + role
                        + " (grid.anchor." + role.configKey() + ")");
            }
            return List.of(anchor);
        }
        List<StampRect> shifted = new ArrayList<>(base.size());
        for (StampRect rect : base) {
            shifted.add(rect.translate(0f, shift));
        }
        return shifted;
    }
}
