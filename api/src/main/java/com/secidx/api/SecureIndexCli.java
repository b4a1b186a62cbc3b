package com.secidx.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.secidx.common.AnonymizedTable;
import com.secidx.common.SecureIndexException;
import com.secidx.common.Token;
import com.secidx.config.IndexConfig;
import com.secidx.crypto.KeyUtils;
import com.secidx.mapping.HeterogeneousMapping;
import com.secidx.mapping.creation.GroupTokenTable;
import com.secidx.query.RewriteResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * Command-line entry point.
 *
 * <pre>
 *   create-mapping &lt;config.json&gt; &lt;dataset.csv&gt; &lt;mapping-out&gt; [group-tokens.csv]
 *   rewrite        &lt;config.json&gt; &lt;mapping&gt; &lt;sql&gt;
 * </pre>
 *
 * The password is read from {@code -Dsecidx.password} or the
 * {@code SECIDX_PASSWORD} environment variable. With a password the mapping is
 * stored encrypted unless {@code -Dsecidx.plaintext=true} is set; the derived
 * key also serves hash and runtime tokens.
 */
public final class SecureIndexCli {

    private static final Logger logger = LoggerFactory.getLogger(SecureIndexCli.class);

    static final int OK = 0;
    static final int USAGE = 1;
    static final int FAILED = 2;

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private SecureIndexCli() {}

    public static void main(String[] args) {
        String password = System.getProperty("secidx.password", System.getenv("SECIDX_PASSWORD"));
        boolean plaintext = Boolean.getBoolean("secidx.plaintext");
        int code = run(List.of(args), password == null ? null : password.toCharArray(), plaintext,
                System.out, System.err);
        System.exit(code);
    }

    static int run(List<String> args, char[] password, boolean plaintext, PrintStream out, PrintStream err) {
        if (args.isEmpty()) {
            usage(err);
            return USAGE;
        }
        String command = args.get(0);
        try {
            switch (command) {
                case "create-mapping" -> {
                    if (args.size() < 4 || args.size() > 5) {
                        usage(err);
                        return USAGE;
                    }
                    createMapping(args, key(password), plaintext, out);
                }
                case "rewrite" -> {
                    if (args.size() != 4) {
                        usage(err);
                        return USAGE;
                    }
                    rewrite(args, key(password), plaintext, out);
                }
                default -> {
                    err.println("Unknown command: " + command);
                    usage(err);
                    return USAGE;
                }
            }
            return OK;
        } catch (IndexConfig.ConfigLoadException | IOException | SecureIndexException e) {
            logger.error("{} failed", command, e);
            err.println("error: " + e.getMessage());
            return FAILED;
        }
    }

    private static SecretKey key(char[] password) {
        if (password == null || password.length == 0) return null;
        return KeyUtils.deriveFromPassword(password);
    }

    private static void createMapping(List<String> args, SecretKey key, boolean plaintext, PrintStream out)
            throws IndexConfig.ConfigLoadException, IOException {
        SecureIndexSystem system = new SecureIndexSystem(IndexConfig.load(args.get(1), false), new SimpleMeterRegistry());
        AnonymizedTable table = system.loadTable(Paths.get(args.get(2)));
        HeterogeneousMapping mapping = system.createMapping(table, key);

        Path target = Paths.get(args.get(3));
        system.saveMapping(mapping, target, plaintext ? null : key);
        out.println("Mapping of " + mapping.getColumns().size() + " columns over " + table.size()
                + " groups written to " + target + (key != null && !plaintext ? " (encrypted)" : ""));

        if (args.size() == 5) {
            GroupTokenTable tokens = system.groupTokens(mapping, table);
            Path tokensPath = Paths.get(args.get(4));
            try (Writer w = Files.newBufferedWriter(tokensPath, StandardCharsets.UTF_8)) {
                tokens.writeCsv(w);
            }
            out.println("Group tokens of " + tokens.size() + " groups written to " + tokensPath);
        }
    }

    private static void rewrite(List<String> args, SecretKey key, boolean plaintext, PrintStream out)
            throws IndexConfig.ConfigLoadException, IOException {
        SecureIndexSystem system = new SecureIndexSystem(IndexConfig.load(args.get(1), false), new SimpleMeterRegistry());
        HeterogeneousMapping mapping = system.loadMapping(Paths.get(args.get(2)), plaintext ? null : key, key);
        RewriteResult result = system.rewrite(mapping, args.get(3));

        if (!result.isKeyValue()) {
            out.println(result.sql());
            return;
        }
        Map<String, Object> plan = new LinkedHashMap<>();
        plan.put("table", result.table());
        Map<String, List<String>> labels = new LinkedHashMap<>();
        for (Map.Entry<String, SortedSet<Token>> e : result.labels().entrySet()) {
            labels.put(e.getKey(), e.getValue().stream().map(Token::toString).toList());
        }
        plan.put("labels", labels);
        out.println(JSON.writeValueAsString(plan));
    }

    private static void usage(PrintStream err) {
        err.println("Usage:");
        err.println("  create-mapping <config.json> <dataset.csv> <mapping-out> [group-tokens.csv]");
        err.println("  rewrite <config.json> <mapping> <sql>");
        err.println("Password: -Dsecidx.password=... or SECIDX_PASSWORD; -Dsecidx.plaintext=true stores the mapping unencrypted");
    }
}
