package com.questrail.goldenbridge.process;

import com.questrail.goldenbridge.model.DumpRequest;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class OracleCommandTest
{
    @Test
    void parseHonoursDoubleQuotes()
    {
        OracleCommand command = OracleCommand.parse("  java -cp \"/opt/epq lib/*\"   epq.reference.TestDump ");
        assertEquals(List.of("java", "-cp", "/opt/epq lib/*", "epq.reference.TestDump"), command.argv());
    }

    @Test
    void blankCommandIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> OracleCommand.parse("   "));
        assertThrows(IllegalArgumentException.class, () -> new OracleCommand(List.of(), null, Map.of()));
    }

    @Test
    void invocationsAppendModeArguments()
    {
        OracleCommand command = OracleCommand.of("oracle");

        assertEquals(List.of("oracle", "batch"), command.batchInvocation(false));
        assertEquals(List.of("oracle", "batch", "--lenient"), command.batchInvocation(true));
        assertEquals(List.of("oracle", "XRayTransition", "Z=26", "trans=1"),
                command.singleInvocation(DumpRequest.parseWireLine("XRayTransition trans=1 Z=26")));
    }

    @Test
    void javaMainClassUsesRunningJvm()
    {
        OracleCommand command = OracleCommand.javaMainClass("com.example.Oracle", List.of("-Xmx256m"));
        List<String> argv = command.argv();

        assertEquals(Paths.get(System.getProperty("java.home"), "bin", "java").toString(), argv.get(0));
        assertEquals("-Xmx256m", argv.get(1));
        assertEquals("-cp", argv.get(2));
        assertFalse(argv.get(3).isEmpty());
        assertEquals("com.example.Oracle", argv.get(4));
    }

    @Test
    void workingDirectoryAndEnvironmentAreCarried()
    {
        OracleCommand command = OracleCommand.of("oracle")
                .withWorkingDirectory(Paths.get("/tmp"))
                .withEnvironment(Map.of("EPQ_HOME", "/opt/epq"));
        assertEquals(Paths.get("/tmp"), command.workingDirectory());
        assertEquals("/opt/epq", command.environment().get("EPQ_HOME"));
    }
}
