package graphslick.view;

import java.awt.Color;

/**
 * Hands out highlight colors.
 * <p>
 * The batch picks the hue and the variant picks brightness and saturation, so
 * the colors of one batch read as a family and never drift into the hue of
 * another batch. The first {@link #VARIANTS_PER_BATCH} variants of a batch are
 * pairwise distinct, and no color is shared between the first
 * {@link #DISTINCT_BATCHES} batches. Past those bounds colors repeat. Two
 * assigners fed the same calls return the same colors.
 */
public class ColorAssigner {
    public static final int VARIANTS_PER_BATCH = 64;

    /** Number of batches with hues of their own */
    public static final int DISTINCT_BATCHES = 24;

    /** Selection color, applied on top of any highlight */
    public static final Color SELECTION_COLOR = new Color(0xAD757C);

    /** Base hues in degrees, ordered so that neighbours contrast; at least 20 degrees apart */
    private static final int[] BASE_HUES = {0, 210, 120, 45, 280, 170, 330, 90, 20, 240, 150, 300};

    /** The second lap over the palette sits halfway between base hues */
    private static final int LAP_SHIFT_DEGREES = 10;

    private static final int BRIGHTNESS_LEVELS = 8;
    private static final float BRIGHTNESS_TOP = 0.96f;
    private static final float BRIGHTNESS_STEP = 0.05f;
    private static final float SATURATION_BOTTOM = 0.25f;
    private static final float SATURATION_STEP = 0.05f;

    private int batchCount = 0;

    /**
     * A family of related colors.
     */
    public static class BatchHandle {
        private final int batchIndex;
        private int variant = 0;

        private BatchHandle(int batchIndex) {
            this.batchIndex = batchIndex;
        }

        public int getBatchIndex() {
            return batchIndex;
        }

        /** Number of colors already taken from this batch */
        public int getVariantCount() {
            return variant;
        }
    }

    public BatchHandle newBatch() {
        return new BatchHandle(batchCount++);
    }

    /**
     * @return the next color of the batch
     */
    public Color nextVariant(BatchHandle handle) {
        Color color = colorOf(handle.batchIndex, handle.variant % VARIANTS_PER_BATCH);
        handle.variant++;
        return color;
    }

    /**
     * Restart batch numbering, e.g. when the highlighting is cleared.
     */
    public void reset() {
        batchCount = 0;
    }

    static Color colorOf(int batchIndex, int variant) {
        int slot = batchIndex % DISTINCT_BATCHES;
        int hue = BASE_HUES[slot % BASE_HUES.length] + (slot / BASE_HUES.length) * LAP_SHIFT_DEGREES;
        int level = variant % BRIGHTNESS_LEVELS;
        int saturationLevel = (variant / BRIGHTNESS_LEVELS) % (VARIANTS_PER_BATCH / BRIGHTNESS_LEVELS);

        float brightness = BRIGHTNESS_TOP - level * BRIGHTNESS_STEP;
        float saturation = SATURATION_BOTTOM + saturationLevel * SATURATION_STEP;
        return Color.getHSBColor((hue % 360) / 360.0f, saturation, brightness);
    }
}
