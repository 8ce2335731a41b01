package dev.blanke.apkinfo.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.intellij.lang.annotations.Language;

import dev.blanke.apkinfo.model.BackendHandle;
import dev.blanke.apkinfo.model.MethodSignature;

/**
 * Backend responses describing a small sub-image, modeled after the output of rizin for a real-world sample.
 * <p>
 * {@code WebServiceCalling.Request} calls {@code WebServiceCalling.Send} once and the imported
 * {@code SmsManager.sendTextMessage} twice.
 */
public final class Fixtures {

    public static final long REQUEST_ADDRESS = 1000;

    public static final long SEND_ADDRESS = 2000;

    public static final long SEND_TEXT_MESSAGE_ADDRESS = 20;

    public static final long FUTURE_TASK_GET_ADDRESS = 10;

    public static final MethodSignature REQUEST = new MethodSignature("Lcom/example/google/service/WebServiceCalling;",
        "Request", "(Landroid/os/Handler;Ljava/lang/String;Ljava/lang/String;)V");

    public static final MethodSignature SEND = new MethodSignature("Lcom/example/google/service/WebServiceCalling;",
        "Send", "(Landroid/os/Handler;Ljava/lang/String;)V");

    public static final MethodSignature SEND_TEXT_MESSAGE = new MethodSignature("Landroid/telephony/SmsManager;",
        "sendTextMessage",
        "(Ljava/lang/String;Ljava/lang/String;Ljava/lang/String;Landroid/app/PendingIntent;Landroid/app/PendingIntent;)V");

    public static final MethodSignature FUTURE_TASK_GET = new MethodSignature("Ljava/util/concurrent/FutureTask;",
        "get", "()Ljava/lang/Object;");

    @Language("JSON")
    public static final String REQUEST_SYMBOL = """
        {
          "type": "METH",
          "name": "void Request(android.os.Handler, String, String)",
          "realname": "Request",
          "flagname": "sym.com.example.google.service.WebServiceCalling_Request",
          "is_imported": false,
          "vaddr": 1000
        }""";

    @Language("JSON")
    public static final String SEND_SYMBOL = """
        {
          "type": "METH",
          "name": "void Send(android.os.Handler, String)",
          "realname": "Send",
          "flagname": "sym.com.example.google.service.WebServiceCalling_Send",
          "is_imported": false,
          "vaddr": 2000
        }""";

    @Language("JSON")
    public static final String SEND_TEXT_MESSAGE_SYMBOL = """
        {
          "type": "METH",
          "name": "imp.sendTextMessage(Ljava/lang/String;Ljava/lang/String;Ljava/lang/String;Landroid/app/PendingIntent;Landroid/app/PendingIntent;)V",
          "realname": "sendTextMessage",
          "flagname": "sym.imp.android.telephony.SmsManager_sendTextMessage",
          "is_imported": true,
          "vaddr": 20
        }""";

    @Language("JSON")
    public static final String FUTURE_TASK_GET_SYMBOL = """
        {
          "type": "METH",
          "name": "imp.get()Ljava/lang/Object;",
          "realname": "get",
          "flagname": "sym.imp.java.util.concurrent.FutureTask_get",
          "is_imported": true,
          "vaddr": 10
        }""";

    /**
     * A field symbol, which is not a method, and a method symbol whose flag name has been damaged.
     */
    public static final String SKIPPED_SYMBOLS = """
        {
          "type": "FIELD",
          "name": "mHandler",
          "realname": "mHandler",
          "flagname": "sym.com.example.google.service.WebServiceCalling_mHandler",
          "is_imported": false,
          "vaddr": 3000
        },
        {
          "type": "METH",
          "name": "foo()V",
          "realname": "foo",
          "flagname": "sym.1234",
          "is_imported": false,
          "vaddr": 4000
        }""";

    /**
     * The symbol listing, which lists {@code Request} twice.
     */
    @Language("JSON")
    public static final String SYMBOLS = "[" + REQUEST_SYMBOL + "," + SEND_SYMBOL + "," + SEND_TEXT_MESSAGE_SYMBOL
        + "," + FUTURE_TASK_GET_SYMBOL + "," + SKIPPED_SYMBOLS + "," + REQUEST_SYMBOL + "]";

    @Language("JSON")
    public static final String CLASSES = """
        [
          { "classname": "Lcom/example/google/service/WebServiceCalling;", "super": "Ljava/lang/Object;" },
          { "classname": "Lcom/example/google/service/MainActivity;", "super": "Landroid/app/Activity;" },
          { "classname": "Lcom/example/google/service/SmsActivity;", "super": "Landroid/app/Activity;" }
        ]""";

    @Language("JSON")
    public static final String STRINGS = """
        [
          { "vaddr": 512, "string": "hello, world" },
          { "vaddr": 540, "string": "+15555215556" }
        ]""";

    /**
     * Callers of {@code Send}: one resolvable call, one call from an unknown address, one call without source
     * address, and a data reference.
     */
    @Language("JSON")
    public static final String SEND_XREFS = """
        [
          { "from": 1004, "type": "CALL" },
          { "from": 9999, "type": "CALL" },
          { "type": "CALL" },
          { "from": 1000, "type": "DATA" }
        ]""";

    @Language("JSON")
    public static final String REQUEST_DISASSEMBLY = """
        {
          "ops": [
            { "offset": 1000, "disasm": "const-string v0, \\"hello, world\\"", "bytes": "1a000100" },
            {
              "offset": 1004,
              "disasm": "invoke-virtual {v1, v2}, Lcom/example/google/service/WebServiceCalling.Send(Landroid/os/Handler;Ljava/lang/String;)V ; 0x7d0",
              "bytes": "6e2012000100",
              "xrefs_from": [ { "addr": 2000, "type": "CALL" } ]
            },
            {
              "offset": 1010,
              "disasm": "invoke-static/range {v0 .. v4}, Landroid/telephony/SmsManager.sendTextMessage(Ljava/lang/String;Ljava/lang/String;Ljava/lang/String;Landroid/app/PendingIntent;Landroid/app/PendingIntent;)V",
              "bytes": "770503000000",
              "xrefs_from": [ { "addr": 20, "type": "CALL" } ]
            },
            {
              "offset": 1016,
              "disasm": "invoke-static/range {v0 .. v4}, Landroid/telephony/SmsManager.sendTextMessage(Ljava/lang/String;Ljava/lang/String;Ljava/lang/String;Landroid/app/PendingIntent;Landroid/app/PendingIntent;)V",
              "bytes": "770503000000",
              "xrefs_from": [ { "addr": 20, "type": "CALL" }, { "addr": 512, "type": "DATA" } ]
            },
            { "offset": 1022, "disasm": "return-void", "bytes": "0e00" }
          ]
        }""";

    @Language("JSON")
    public static final String SEND_DISASSEMBLY = """
        {
          "ops": [
            { "offset": 2000, "disasm": "return-void", "bytes": "0e00" }
          ]
        }""";

    /**
     * The content of a minimal DEX file header.
     */
    private static final byte[] DEX_HEADER = "dex\n035\0".getBytes(StandardCharsets.US_ASCII);

    private Fixtures() {
    }

    /**
     * Returns a channel answering all queries about the sub-image described by this class.
     */
    public static ScriptedChannel channel() {
        return new ScriptedChannel()
            .respond("isj",            SYMBOLS)
            .respond("icj",            CLASSES)
            .respond("izzj",           STRINGS)
            .respond("axtj @ 2000",    SEND_XREFS)
            .respond("pdfj @ 1000",    REQUEST_DISASSEMBLY)
            .respond("pdfj @ 2000",    SEND_DISASSEMBLY)
            .respond("is.j @ 1000",    "[" + REQUEST_SYMBOL + "]")
            .respond("is.j @ 1004",    "[" + REQUEST_SYMBOL + "]")
            .respond("is.j @ 2000",    "[" + SEND_SYMBOL + "]")
            .respond("is.j @ 20",      "[" + SEND_TEXT_MESSAGE_SYMBOL + "]")
            .respond("is.j @ 10",      "[" + FUTURE_TASK_GET_SYMBOL + "]");
    }

    /**
     * Returns a copy of the {@code method} carrying a handle to the provided location, as if listed by a backend.
     */
    public static MethodSignature located(final MethodSignature method, final int subImageIndex, final long address,
                                          final boolean imported) {
        return new MethodSignature(method.classDescriptor(), method.name(), method.descriptor(), null,
            new BackendHandle(subImageIndex, address, imported));
    }

    /**
     * Creates a file starting with the DEX magic number inside the provided {@code directory}.
     */
    public static Path dexFile(final Path directory, final String name) throws IOException {
        return Files.write(directory.resolve(name), DEX_HEADER);
    }
}
