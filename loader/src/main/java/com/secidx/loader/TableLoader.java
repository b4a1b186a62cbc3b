package com.secidx.loader;

import com.secidx.common.AnonymizedTable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;

/**
 * Reads an anonymized table: a header naming the columns, then one record per
 * original row holding generalizations and the group id.
 */
public interface TableLoader {

    /** Header of the file. */
    List<String> readHeader(Path file) throws IOException;

    /** Records after the header, lazily. The iterator closes the file once exhausted. */
    Iterator<String[]> openRecordIterator(Path file) throws IOException;

    /** Whole table, every column kept. */
    AnonymizedTable load(Path file, String groupIdColumn) throws IOException;
}
