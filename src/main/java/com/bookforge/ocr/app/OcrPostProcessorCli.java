package com.bookforge.ocr.app;

import com.bookforge.ocr.layout.OcrPostProcessor;
import com.bookforge.ocr.layout.OcrPostProcessorConfig;
import com.bookforge.ocr.model.ProcessedResult;
import com.bookforge.ocr.model.json.OcrDocument;
import com.bookforge.ocr.model.json.OcrDocumentReader;
import com.bookforge.ocr.model.json.OcrInputException;
import com.bookforge.ocr.model.json.ProcessedResultWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Runs the post-processor over an OCR document on disk.
 *
 * <pre>OcrPostProcessorCli &lt;input.json&gt; [output.json]</pre>
 *
 * Without an output path the result is printed to standard output.
 */
public class OcrPostProcessorCli {

    private static final Logger LOGGER = LoggerFactory.getLogger(OcrPostProcessorCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_INPUT_ERROR = 2;
    static final int EXIT_OUTPUT_ERROR = 3;

    private static final String USAGE = "Usage: OcrPostProcessorCli <input.json> [output.json]";

    private final OcrDocumentReader reader;
    private final OcrPostProcessor processor;
    private final ProcessedResultWriter writer;

    public OcrPostProcessorCli(OcrPostProcessorConfig config) {
        this.reader = new OcrDocumentReader();
        this.processor = new OcrPostProcessor(config);
        this.writer = new ProcessedResultWriter();
    }

    public int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 1 || args.length > 2) {
            LOGGER.error(USAGE);
            err.println(USAGE);
            return EXIT_USAGE;
        }

        Path input = Paths.get(args[0]);
        LOGGER.info("Input document: {}", input);

        OcrDocument document;
        try {
            document = reader.read(input);
        } catch (OcrInputException e) {
            LOGGER.error("Unable to load OCR document {}", input, e);
            err.println("Error: " + e.getMessage());
            return EXIT_INPUT_ERROR;
        }

        ProcessedResult result = processor.process(
            document.getLines(), document.getPageDimensions(), document.getLayoutRegionsByPage());

        try {
            if (args.length == 2) {
                Path output = Paths.get(args[1]);
                writer.write(result, output);
                LOGGER.info("Wrote {} blocks to {}", result.getBlocks().size(), output);
            } else {
                writer.write(result, out);
                out.println();
                out.flush();
            }
        } catch (IOException e) {
            LOGGER.error("Unable to write processed result", e);
            err.println("Error: " + e.getMessage());
            return EXIT_OUTPUT_ERROR;
        }
        return EXIT_OK;
    }

    public static void main(String[] args) {
        int status = new OcrPostProcessorCli(new OcrPostProcessorConfig()).run(args, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }
}
