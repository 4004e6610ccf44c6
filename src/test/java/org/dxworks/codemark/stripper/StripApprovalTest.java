package org.dxworks.codemark.stripper;

import org.approvaltests.Approvals;
import org.dxworks.codemark.GrammarRegistry;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class StripApprovalTest {
    private static final String SAMPLES_BASE_PATH = "src/test/resources/samples/";

    @Test
    void strip_PowerShell_Deploy() throws IOException {
        verify("powershell/Deploy.ps1");
    }

    @Test
    void strip_CSharp_OrderService() throws IOException {
        verify("csharp/OrderService.cs");
    }

    @Test
    void strip_Sql_Schema() throws IOException {
        verify("sql/schema.sql");
    }

    @Test
    void strip_Python_Loader() throws IOException {
        verify("python/loader.py");
    }

    @Test
    void strip_Html_Index() throws IOException {
        verify("html/index.html");
    }

    private static void verify(String sample) throws IOException {
        Path filePath = Paths.get(SAMPLES_BASE_PATH + sample);
        String content = Files.readString(filePath, StandardCharsets.UTF_8);
        Approvals.verify(CommentStripping.stripComments(content, GrammarRegistry.extensionOf(filePath)));
    }
}
