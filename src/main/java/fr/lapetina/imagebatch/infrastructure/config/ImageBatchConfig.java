package fr.lapetina.imagebatch.infrastructure.config;

import fr.lapetina.imagebatch.domain.model.Dimensions;
import fr.lapetina.imagebatch.domain.model.ImageCodec;
import fr.lapetina.imagebatch.domain.model.TransformParameters;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the batch processor.
 * Designed to be populated from YAML.
 */
public class ImageBatchConfig {

    private InputConfig input = new InputConfig();
    private OutputConfig output = new OutputConfig();
    private TransformConfig transform = new TransformConfig();
    private ExecutionConfig execution = new ExecutionConfig();
    private EncodingConfig encoding = new EncodingConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private ReportConfig report = new ReportConfig();

    // Getters and Setters
    public InputConfig getInput() { return input; }
    public void setInput(InputConfig input) { this.input = input; }

    public OutputConfig getOutput() { return output; }
    public void setOutput(OutputConfig output) { this.output = output; }

    public TransformConfig getTransform() { return transform; }
    public void setTransform(TransformConfig transform) { this.transform = transform; }

    public ExecutionConfig getExecution() { return execution; }
    public void setExecution(ExecutionConfig execution) { this.execution = execution; }

    public EncodingConfig getEncoding() { return encoding; }
    public void setEncoding(EncodingConfig encoding) { this.encoding = encoding; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public ReportConfig getReport() { return report; }
    public void setReport(ReportConfig report) { this.report = report; }

    /**
     * Input discovery configuration.
     */
    public static class InputConfig {
        private String directory = "data/input";
        private List<String> extensions = new ArrayList<>(List.of(".jpg", ".jpeg", ".png", ".bmp", ".tiff"));

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public List<String> getExtensions() { return extensions; }
        public void setExtensions(List<String> extensions) { this.extensions = extensions; }
    }

    /**
     * Output naming configuration.
     */
    public static class OutputConfig {
        private String directory = "data/output";
        private String prefix = "processed_";
        private String format;

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        /**
         * Explicit output codec name, or null to follow the output file extension.
         */
        public String getFormat() { return format; }
        public void setFormat(String format) { this.format = format; }

        public ImageCodec resolveFormatOverride() {
            if (format == null || format.isBlank()) {
                return null;
            }
            return ImageCodec.fromName(format)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown output format: " + format));
        }
    }

    /**
     * Transform parameters. Width and height must be set together; leaving both unset
     * keeps the source size.
     */
    public static class TransformConfig {
        private Integer width = 800;
        private Integer height = 600;
        private double blurRadius = 1.0;
        private double sharpenFactor = 1.5;
        private double contrastFactor = 1.2;
        private double brightnessFactor = 1.1;

        public Integer getWidth() { return width; }
        public void setWidth(Integer width) { this.width = width; }

        public Integer getHeight() { return height; }
        public void setHeight(Integer height) { this.height = height; }

        public double getBlurRadius() { return blurRadius; }
        public void setBlurRadius(double blurRadius) { this.blurRadius = blurRadius; }

        public double getSharpenFactor() { return sharpenFactor; }
        public void setSharpenFactor(double sharpenFactor) { this.sharpenFactor = sharpenFactor; }

        public double getContrastFactor() { return contrastFactor; }
        public void setContrastFactor(double contrastFactor) { this.contrastFactor = contrastFactor; }

        public double getBrightnessFactor() { return brightnessFactor; }
        public void setBrightnessFactor(double brightnessFactor) { this.brightnessFactor = brightnessFactor; }

        public TransformParameters toParameters() {
            if ((width == null) != (height == null)) {
                throw new IllegalArgumentException("transform.width and transform.height must be set together");
            }
            Dimensions resize = width != null ? Dimensions.of(width, height) : null;
            return new TransformParameters(resize, blurRadius, sharpenFactor, contrastFactor, brightnessFactor);
        }
    }

    /**
     * Worker pool and ring buffer configuration.
     */
    public static class ExecutionConfig {
        private int workers = 1;
        private int ringBufferSize = 256;
        private String waitStrategy = "blocking";

        public int getWorkers() { return workers; }
        public void setWorkers(int workers) { this.workers = workers; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Codec settings.
     */
    public static class EncodingConfig {
        private double jpegQuality = 0.9;
        private String tiffCompression = "LZW";

        public double getJpegQuality() { return jpegQuality; }
        public void setJpegQuality(double jpegQuality) { this.jpegQuality = jpegQuality; }

        public String getTiffCompression() { return tiffCompression; }
        public void setTiffCompression(String tiffCompression) { this.tiffCompression = tiffCompression; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "image_batch";
        private String exportFile;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        /**
         * File receiving the Prometheus scrape after a batch, or null to skip it.
         */
        public String getExportFile() { return exportFile; }
        public void setExportFile(String exportFile) { this.exportFile = exportFile; }
    }

    /**
     * Batch report configuration.
     */
    public static class ReportConfig {
        private boolean enabled = true;
        private String directory = "reports";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }
}
