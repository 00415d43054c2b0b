package github.sarthakdev143.render_farm.model.graph;

public final class OutputSlot {

    private final String name;
    private final ImageFormat format;
    private String path;

    public OutputSlot(String name, String path, ImageFormat format) {
        this.name = name;
        this.path = path;
        this.format = format;
    }

    public String name() {
        return name;
    }

    public String path() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public ImageFormat format() {
        return format;
    }

    OutputSlot copy() {
        return new OutputSlot(name, path, format);
    }
}
