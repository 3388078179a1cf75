package colorbatch.engine;

import java.awt.image.*;

/**
 * Deterministic stand-in for a learned colorization model.
 * <p>
 * Each pixel's luminance is mapped onto a three-stop palette (cool shadows, neutral
 * midtones, warm highlights) and blended with the original gray so detail survives.
 * Progress is reported once per row.
 */
public class ToneMapColorizer implements Colorizer {

    private static final int[] SHADOW    = {  28,  36,  64 };
    private static final int[] MIDTONE   = { 146, 122,  98 };
    private static final int[] HIGHLIGHT = { 255, 243, 222 };

    private static final double TINT_STRENGTH = 0.65;

    @Override
    public Picture colorize(Picture input, ProgressListener progress) {
        BufferedImage imageIn = input.image();
        int width = imageIn.getWidth();
        int height = imageIn.getHeight();

        BufferedImage imageOut = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[width];

        progress.onProgress(0f);
        for (int y = 0; y < height; y++) {
            imageIn.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                row[x] = tint(row[x]);
            }
            imageOut.setRGB(0, y, width, 1, row, 0, width);
            progress.onProgress(100f * (y + 1) / height);
        }
        return new Picture(imageOut);
    }

    static int tint(int argb) {
        int r = (argb >> 16) & 0xFF;
        int g = (argb >> 8) & 0xFF;
        int b = argb & 0xFF;

        // Rec. 601 luma, same weights as the grayscale conversion
        double luma = (0.299 * r + 0.587 * g + 0.114 * b) / 255.0;

        int[] from;
        int[] to;
        double t;
        if (luma < 0.5) {
            from = SHADOW;
            to = MIDTONE;
            t = luma * 2;
        } else {
            from = MIDTONE;
            to = HIGHLIGHT;
            t = (luma - 0.5) * 2;
        }

        int gray = (int) Math.round(luma * 255);
        int outR = blend(gray, lerp(from[0], to[0], t));
        int outG = blend(gray, lerp(from[1], to[1], t));
        int outB = blend(gray, lerp(from[2], to[2], t));
        return (outR << 16) | (outG << 8) | outB;
    }

    private static double lerp(int a, int b, double t) {
        return a + (b - a) * t;
    }

    private static int blend(int gray, double tint) {
        int v = (int) Math.round(gray * (1 - TINT_STRENGTH) + tint * TINT_STRENGTH);
        if (v < 0) return 0;
        return Math.min(v, 255);
    }
}
