package github.sarthakdev143.render_farm.service.impl;

import github.sarthakdev143.render_farm.dto.ImageFormatRequest;
import github.sarthakdev143.render_farm.dto.OutputGraphManifestRequest;
import github.sarthakdev143.render_farm.dto.OutputNodeRequest;
import github.sarthakdev143.render_farm.dto.OutputSlotRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Standard VFX pass layout: beauty and lighting passes in a 16-bit multilayer EXR, utility
 * passes and Cryptomatte in 32-bit ones.
 */
public final class VfxAovPreset {

    public static final String DEFAULT_BASE_PATH = "//renders/";

    private static final String MULTILAYER_EXR = "OPEN_EXR_MULTILAYER";
    private static final String RGBA = "RGBA";
    private static final int CRYPTOMATTE_LEVELS = 3;

    private static final List<String> MAIN_PASSES = List.of(
            "rgba",
            "diffuseDirect",
            "diffuseIndirect",
            "diffuseColor",
            "specularDirect",
            "specularIndirect",
            "specularColor",
            "transmissionDirect",
            "transmissionIndirect",
            "transmissionColor",
            "emission",
            "background",
            "shadow",
            "ao");
    private static final List<String> DATA_PASSES = List.of("normal", "depth", "position", "motion");
    private static final List<String> CRYPTOMATTE_TYPES = List.of("CryptoObject", "CryptoMaterial", "CryptoAsset");

    private VfxAovPreset() {
    }

    public static OutputGraphManifestRequest manifest(String basePath) {
        String directory = normalizeDirectory(basePath);
        List<OutputNodeRequest> nodes = List.of(
                node("main", directory, 16, MAIN_PASSES),
                node("data", directory, 32, DATA_PASSES),
                node("crypto", directory, 32, cryptomattePasses()));
        return new OutputGraphManifestRequest(1, 250, 1, nodes);
    }

    private static OutputNodeRequest node(String name, String directory, int colorDepth, List<String> passes) {
        List<OutputSlotRequest> slots = new ArrayList<>(passes.size());
        for (String pass : passes) {
            slots.add(new OutputSlotRequest(pass, pass, null));
        }
        return new OutputNodeRequest(
                name,
                directory + name + ".####.exr",
                new ImageFormatRequest(MULTILAYER_EXR, colorDepth, RGBA),
                slots);
    }

    private static List<String> cryptomattePasses() {
        List<String> passes = new ArrayList<>(CRYPTOMATTE_TYPES);
        for (int level = 0; level < CRYPTOMATTE_LEVELS; level++) {
            for (String type : CRYPTOMATTE_TYPES) {
                passes.add(type + String.format(Locale.ROOT, "%02d", level));
            }
        }
        return passes;
    }

    private static String normalizeDirectory(String basePath) {
        if (basePath == null || basePath.isBlank()) {
            return DEFAULT_BASE_PATH;
        }
        String trimmed = basePath.trim();
        return trimmed.endsWith("/") ? trimmed : trimmed + "/";
    }
}
