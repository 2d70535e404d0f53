package org.dxworks.markframe.parser;

import org.approvaltests.Approvals;
import org.dxworks.markframe.TestUtils;
import org.dxworks.markframe.model.Node;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class MarkdownParserApprovalTest {
    private static final String SAMPLES_BASE_PATH = "src/test/resources/samples/markdown/";

    @Test
    void parse_Basic() throws IOException {
        verify("Basic.md");
    }

    @Test
    void parse_Tables() throws IOException {
        verify("Tables.md");
    }

    private static void verify(String fileName) throws IOException {
        Path filePath = Paths.get(SAMPLES_BASE_PATH + fileName);
        Node doc = new MarkdownParser().parse(Files.readString(filePath, StandardCharsets.UTF_8)).getDocument();
        Approvals.verify(TestUtils.printed(doc));
    }
}
