package com.secidx.loader;

import com.secidx.common.AnonymizedTable;
import com.secidx.common.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnonymizedCsvLoaderTest {

    @TempDir
    Path tmp;

    @Test
    void anonymizedCsv_withCommentsQuotesAndSets_isParsed() throws Exception {
        Path f = tmp.resolve("people.csv");
        String csv = "# anonymized export\n"
                + "GID,AGE,CITY,NOTE\n"
                + "\n"
                + "1,[0-9],\"{Milan,Rome}\",plain\n"
                + "1,[0-9],{Milan,Rome},\"say \"\"hi\"\"\"\n"
                + "2, [10-20) ,Paris,\"two\n"
                + "lines\"\n";
        Files.writeString(f, csv);

        AnonymizedTable table = new AnonymizedCsvLoader().load(f, "GID");

        assertEquals(List.of("GID", "AGE", "CITY", "NOTE"), table.getColumns());
        assertEquals(3, table.size());
        assertEquals("{Milan,Rome}", table.value(0, "CITY"));
        assertEquals("{Milan,Rome}", table.value(1, "CITY"));
        assertEquals("say \"hi\"", table.value(1, "NOTE"));
        assertEquals("[10-20)", table.value(2, "AGE"));
        assertEquals("two\nlines", table.value(2, "NOTE"));
        assertEquals(2, table.distinctByGroup().size());
    }

    @Test
    void utf8Bom_isStripped() throws Exception {
        Path f = tmp.resolve("bom.csv");
        byte[] body = "GID,AGE\n7,[1-2]\n".getBytes(StandardCharsets.UTF_8);
        byte[] withBom = new byte[body.length + 3];
        withBom[0] = (byte) 0xEF;
        withBom[1] = (byte) 0xBB;
        withBom[2] = (byte) 0xBF;
        System.arraycopy(body, 0, withBom, 3, body.length);
        Files.write(f, withBom);

        AnonymizedCsvLoader loader = new AnonymizedCsvLoader();
        assertEquals(List.of("GID", "AGE"), loader.readHeader(f));
        assertEquals(7L, loader.load(f, "GID").groupId(0));
    }

    @Test
    void recordIterator_streamsRecords() throws Exception {
        Path f = tmp.resolve("rows.csv");
        Files.writeString(f, "GID;AGE\n1;[0-9]\n2;[10-19]\n");

        Iterator<String[]> it = new AnonymizedCsvLoader(';').openRecordIterator(f);
        List<String[]> rows = new ArrayList<>();
        while (it.hasNext()) rows.add(it.next());

        assertEquals(2, rows.size());
        assertArrayEquals(new String[]{"2", "[10-19]"}, rows.get(1));
    }

    @Test
    void wrongFieldCount_isAnError() throws Exception {
        Path f = tmp.resolve("bad.csv");
        Files.writeString(f, "GID,AGE\n1,[0-9],extra\n");
        IOException e = assertThrows(IOException.class, () -> new AnonymizedCsvLoader().load(f, "GID"));
        assertTrue(e.getMessage().contains("line 2"));
    }

    @Test
    void unterminatedQuote_isAnError() throws Exception {
        Path f = tmp.resolve("quote.csv");
        Files.writeString(f, "GID,AGE\n1,\"[0-9]\n");
        assertThrows(IOException.class, () -> new AnonymizedCsvLoader().load(f, "GID"));
    }

    @Test
    void missingGroupIdColumn_isAConfigurationError() throws Exception {
        Path f = tmp.resolve("nogid.csv");
        Files.writeString(f, "AGE\n[0-9]\n");
        assertThrows(ConfigurationException.class, () -> new AnonymizedCsvLoader().load(f, "GID"));
    }

    @Test
    void emptyFile_hasNoHeader() throws Exception {
        Path f = tmp.resolve("empty.csv");
        Files.writeString(f, "# nothing\n\n");
        assertThrows(IOException.class, () -> new AnonymizedCsvLoader().readHeader(f));
    }
}
