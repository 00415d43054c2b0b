package github.sarthakdev143.render_farm.model;

public record RenderJobOptions(
        RenderType renderType,
        Integer frame,
        Integer startFrame,
        Integer endFrame,
        int concurrencyLimit,
        boolean gpu,
        boolean upload,
        String uploadFolder,
        String outputRoot) {

    public RenderJobOptions {
        renderType = renderType == null ? RenderType.FRAME : renderType;
        uploadFolder = uploadFolder == null || uploadFolder.isBlank() ? "/Renders" : uploadFolder;
        outputRoot = outputRoot == null || outputRoot.isBlank() ? null : outputRoot;
    }

    /**
     * Resolves the frames to render. FRAME falls back to the scene's current frame and
     * ANIMATION always uses the scene's own range.
     */
    public FrameSpec resolveFrameSpec(SceneDescription scene) {
        return switch (renderType) {
            case FRAME -> FrameSpec.single(frame != null ? frame : scene.frameCurrent());
            case ANIMATION -> FrameSpec.range(scene.frameStart(), scene.frameEnd());
            case RANGE -> {
                if (startFrame == null || endFrame == null) {
                    throw new IllegalArgumentException("startFrame and endFrame are required for RANGE renders.");
                }
                yield FrameSpec.range(startFrame, endFrame);
            }
        };
    }
}
