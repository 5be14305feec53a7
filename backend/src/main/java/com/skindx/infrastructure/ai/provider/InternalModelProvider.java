package com.skindx.infrastructure.ai.provider;

import com.skindx.domain.diagnosis.model.AiTask;
import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.skindx.infrastructure.ai.TaskInputKeys.*;

/**
 * In-process heuristic model. Always available (unless switched off) and used as the
 * first or last resort in most routing chains.
 *
 * <ul>
 *   <li>stage0: image size and a colour-rule skin ratio</li>
 *   <li>stage1: colour variance, high variance reads as abnormal</li>
 *   <li>stage2-4: fixed low-confidence defaults</li>
 * </ul>
 */
@Slf4j
public class InternalModelProvider implements AiProvider {

    static final int SAMPLE_SIZE = 100;
    static final int MIN_DIMENSION = 100;
    static final double SKIN_RATIO_THRESHOLD = 0.2;
    static final double ABNORMAL_VARIANCE_THRESHOLD = 1500.0;

    private static final Map<String, String> DEFAULT_DISEASE_BY_CATEGORY = Map.of(
            "infectious", "tinea_corporis",
            "inflammatory", "atopic_dermatitis",
            "neoplastic", "basal_cell_carcinoma",
            "allergic", "contact_dermatitis",
            "autoimmune", "vitiligo"
    );

    private final Duration timeout;

    public InternalModelProvider(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.INTERNAL;
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public ProviderResponse execute(AiTask task, Map<String, Object> input) {
        return switch (task) {
            case STAGE0_VALIDATION -> validateImage(input);
            case STAGE1_NORMAL_ABNORMAL -> classifyNormalAbnormal(input);
            case STAGE2_CATEGORY -> ProviderResponse.ok(output(
                    "category", "inflammatory",
                    "subcategory", "dermatitis",
                    "confidence", 0.5));
            case STAGE3_DIAGNOSIS -> diagnose(input);
            case STAGE4_FUSION -> fuse(input);
        };
    }

    @Override
    public String chat(List<ChatMessage> messages) {
        throw new ProviderCallException("Internal model does not support chat");
    }

    private ProviderResponse validateImage(Map<String, Object> input) {
        BufferedImage image;
        try {
            image = readImage(input);
        } catch (IOException e) {
            log.error("[Internal] Image validation error: {}", e.getMessage());
            return ProviderResponse.failure(e.getMessage());
        }
        if (image == null) {
            return ProviderResponse.failure("Unreadable image");
        }

        boolean usable = image.getWidth() >= MIN_DIMENSION && image.getHeight() >= MIN_DIMENSION;
        boolean skin = isGrayscale(image) || skinRatio(sample(image)) > SKIN_RATIO_THRESHOLD;

        return ProviderResponse.ok(output(
                "is_skin", skin,
                "is_medical", true,
                "is_usable", usable,
                "confidence", skin ? 0.75 : 0.4));
    }

    private ProviderResponse classifyNormalAbnormal(Map<String, Object> input) {
        try {
            BufferedImage image = readImage(input);
            if (image != null) {
                boolean abnormal = variance(sample(image)) > ABNORMAL_VARIANCE_THRESHOLD;
                return ProviderResponse.ok(output(
                        "classification", abnormal ? "abnormal" : "normal",
                        "confidence", 0.65));
            }
        } catch (IOException e) {
            log.error("[Internal] Classification error: {}", e.getMessage());
        }
        return ProviderResponse.ok(output("classification", "abnormal", "confidence", 0.5));
    }

    private ProviderResponse diagnose(Map<String, Object> input) {
        Object category = input.get(CATEGORY);
        String disease = DEFAULT_DISEASE_BY_CATEGORY.getOrDefault(
                category != null ? category.toString() : "inflammatory", "atopic_dermatitis");
        return ProviderResponse.ok(output(
                "disease", disease,
                "confidence", 0.45,
                "severity", "moderate",
                "differential", List.of()));
    }

    private ProviderResponse fuse(Map<String, Object> input) {
        Map<?, ?> stage3 = input.get(STAGE3) instanceof Map<?, ?> m ? m : Map.of();
        Object disease = stage3.get("disease");
        Object severity = stage3.get("severity");
        return ProviderResponse.ok(output(
                "diagnosis", disease != null ? disease : "unknown",
                "confidence", 0.55,
                "severity", severity != null ? severity : "moderate",
                "urgency", "routine",
                "explanation", "Analysis complete. Please consult a doctor for confirmation.",
                "recommendations", List.of("Consult a dermatologist", "Keep area clean")));
    }

    private static BufferedImage readImage(Map<String, Object> input) throws IOException {
        if (input.get(IMAGE_BYTES) instanceof byte[] bytes && bytes.length > 0) {
            return ImageIO.read(new ByteArrayInputStream(bytes));
        }
        if (input.get(IMAGE_PATH) instanceof String path && !path.isBlank()) {
            return ImageIO.read(Path.of(path).toFile());
        }
        throw new IOException("No image provided");
    }

    private static boolean isGrayscale(BufferedImage image) {
        return image.getColorModel().getColorSpace().getType() == ColorSpace.TYPE_GRAY;
    }

    static BufferedImage sample(BufferedImage image) {
        BufferedImage scaled = new BufferedImage(SAMPLE_SIZE, SAMPLE_SIZE, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(image, 0, 0, SAMPLE_SIZE, SAMPLE_SIZE, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

    static double skinRatio(BufferedImage sample) {
        int skinPixels = 0;
        int total = sample.getWidth() * sample.getHeight();
        for (int y = 0; y < sample.getHeight(); y++) {
            for (int x = 0; x < sample.getWidth(); x++) {
                int rgb = sample.getRGB(x, y);
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                if (r > 95 && g > 40 && b > 20 && r > g && r > b && Math.abs(r - g) > 15) {
                    skinPixels++;
                }
            }
        }
        return (double) skinPixels / total;
    }

    /**
     * Variance over every channel value of the sample.
     */
    static double variance(BufferedImage sample) {
        long n = 0;
        double sum = 0;
        double sumSquares = 0;
        for (int y = 0; y < sample.getHeight(); y++) {
            for (int x = 0; x < sample.getWidth(); x++) {
                int rgb = sample.getRGB(x, y);
                for (int shift = 16; shift >= 0; shift -= 8) {
                    int v = (rgb >> shift) & 0xFF;
                    sum += v;
                    sumSquares += (double) v * v;
                    n++;
                }
            }
        }
        double mean = sum / n;
        return sumSquares / n - mean * mean;
    }

    private static Map<String, Object> output(Object... keyValues) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            data.put((String) keyValues[i], keyValues[i + 1]);
        }
        return data;
    }
}
