package com.secidx.loader;

import com.secidx.common.AnonymizedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * CSV loader for anonymized tables.
 * - The first non-empty, non-comment line is the header.
 * - Skips blank lines and lines starting with '#' (comments).
 * - Fields may be double-quoted with "" as an escaped quote (RFC 4180).
 * - Commas inside unquoted {...} or [...] generalizations do not split fields.
 * - Handles UTF-8 BOM if present.
 * - A record with a field count differing from the header is an error.
 */
public class AnonymizedCsvLoader implements TableLoader {

    private static final Logger logger = LoggerFactory.getLogger(AnonymizedCsvLoader.class);

    private final char delimiter;

    public AnonymizedCsvLoader() {
        this(',');
    }

    public AnonymizedCsvLoader(char delimiter) {
        if (delimiter == '"' || delimiter == '\n' || delimiter == '\r') {
            throw new IllegalArgumentException("Invalid delimiter: " + delimiter);
        }
        this.delimiter = delimiter;
    }

    @Override
    public List<String> readHeader(Path file) throws IOException {
        try (BufferedReader br = newBufferedReader(file)) {
            String line = nextContentLine(br);
            if (line == null) throw new EOFException("No header in " + file);
            return header(split(line, 1), file);
        }
    }

    @Override
    public Iterator<String[]> openRecordIterator(Path file) throws IOException {
        BufferedReader br = newBufferedReader(file);
        String headerLine;
        try {
            headerLine = nextContentLine(br);
        } catch (IOException e) {
            closeQuietly(br);
            throw e;
        }
        if (headerLine == null) {
            closeQuietly(br);
            throw new EOFException("No header in " + file);
        }
        int width = split(headerLine, 1).length;

        return new Iterator<>() {
            int lineNo = 1;
            String[] next = fetch();

            private String[] fetch() {
                try {
                    String line;
                    while ((line = br.readLine()) != null) {
                        lineNo++;
                        if (line.isBlank() || line.trim().charAt(0) == '#') continue;
                        String record = completeRecord(br, line);
                        String[] fields = split(record, lineNo);
                        if (fields.length != width) {
                            throw new UncheckedIOException(new IOException(file + ": record at line " + lineNo
                                    + " has " + fields.length + " fields, expected " + width));
                        }
                        return fields;
                    }
                    closeQuietly(br);
                    return null;
                } catch (IOException e) {
                    closeQuietly(br);
                    throw new UncheckedIOException(e);
                } catch (UncheckedIOException e) {
                    closeQuietly(br);
                    throw e;
                }
            }

            // a quoted field may span lines
            private String completeRecord(BufferedReader reader, String first) throws IOException {
                StringBuilder sb = new StringBuilder(first);
                while (unbalancedQuotes(sb)) {
                    String more = reader.readLine();
                    if (more == null) {
                        throw new IOException(file + ": unterminated quoted field starting at line " + lineNo);
                    }
                    lineNo++;
                    sb.append('\n').append(more);
                }
                return sb.toString();
            }

            @Override public boolean hasNext() { return next != null; }

            @Override public String[] next() {
                if (next == null) throw new NoSuchElementException();
                String[] out = next;
                next = fetch();
                return out;
            }
        };
    }

    @Override
    public AnonymizedTable load(Path file, String groupIdColumn) throws IOException {
        Objects.requireNonNull(groupIdColumn, "groupIdColumn");
        List<String> header = readHeader(file);
        List<String[]> rows = new ArrayList<>();
        try {
            Iterator<String[]> it = openRecordIterator(file);
            while (it.hasNext()) rows.add(it.next());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        AnonymizedTable table = new AnonymizedTable(header, groupIdColumn, rows);
        logger.info("Loaded {} rows x {} columns from {}", table.size(), header.size(), file);
        return table;
    }

    /* -------------------- helpers -------------------- */

    private static List<String> header(String[] fields, Path file) throws IOException {
        List<String> out = new ArrayList<>(fields.length);
        for (String f : fields) {
            String name = f.trim();
            if (name.isEmpty()) throw new IOException(file + ": blank column name in header");
            out.add(name);
        }
        return out;
    }

    private static String nextContentLine(BufferedReader br) throws IOException {
        String line;
        while ((line = br.readLine()) != null) {
            if (line.isBlank() || line.trim().charAt(0) == '#') continue;
            return line;
        }
        return null;
    }

    private static boolean unbalancedQuotes(CharSequence s) {
        int quotes = 0;
        for (int i = 0; i < s.length(); i++) if (s.charAt(i) == '"') quotes++;
        return (quotes & 1) == 1;
    }

    String[] split(String record, int lineNo) throws IOException {
        List<String> fields = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean quoted = false;
        boolean wasQuoted = false;
        int depth = 0;
        for (int i = 0; i < record.length(); i++) {
            char c = record.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < record.length() && record.charAt(i + 1) == '"') {
                        cur.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    cur.append(c);
                }
            } else if (c == '"' && cur.toString().isBlank()) {
                quoted = true;
                wasQuoted = true;
                cur.setLength(0);
            } else if (c == delimiter && depth == 0) {
                fields.add(wasQuoted ? cur.toString() : cur.toString().trim());
                cur.setLength(0);
                wasQuoted = false;
            } else {
                if (c == '{' || c == '[') depth++;
                else if ((c == '}' || c == ']' || c == ')') && depth > 0) depth--;
                cur.append(c);
            }
        }
        if (quoted) throw new IOException("Unterminated quoted field at line " + lineNo);
        fields.add(wasQuoted ? cur.toString() : cur.toString().trim());
        return fields.toArray(new String[0]);
    }

    private static BufferedReader newBufferedReader(Path file) throws IOException {
        InputStream in = Files.newInputStream(file);
        // Strip UTF-8 BOM if present
        PushbackInputStream pb = new PushbackInputStream(in, 3);
        byte[] bom = new byte[3];
        int n = pb.read(bom, 0, 3);
        if (n == 3 && !(bom[0] == (byte) 0xEF && bom[1] == (byte) 0xBB && bom[2] == (byte) 0xBF)) {
            pb.unread(bom, 0, 3);
        } else if (n > 0 && n < 3) {
            pb.unread(bom, 0, n);
        }
        return new BufferedReader(new InputStreamReader(pb, StandardCharsets.UTF_8));
    }

    private static void closeQuietly(Closeable c) {
        try {
            c.close();
        } catch (IOException e) {
            logger.debug("Failed to close reader", e);
        }
    }
}
