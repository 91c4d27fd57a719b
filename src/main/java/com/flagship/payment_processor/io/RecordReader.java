package com.flagship.payment_processor.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.payment_processor.event.PaymentRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Reads {@link PaymentRecord}s from CSV with a {@code type,client,tx,amount} header.
 *
 * Rows are streamed, never loaded all at once. A bad row surfaces as a
 * {@link MalformedRecordException} from {@link RecordCursor#next()} and the cursor moves
 * on to the following row.
 */
@Component
@RequiredArgsConstructor
public class RecordReader {

    static final int MAX_CLIENT_ID = 0xFFFF;
    static final long MAX_TX_ID = 0xFFFF_FFFFL;

    private final CsvMapper csvMapper;

    /**
     * Opens a cursor over the rows of {@code input}. Closing the cursor closes the input.
     */
    public RecordCursor open(Reader input) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try {
            MappingIterator<PaymentRecord> rows = csvMapper.readerFor(PaymentRecord.class)
                .with(schema)
                .readValues(input);
            return new RecordCursor(rows, input);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open CSV input", e);
        }
    }

    /**
     * Iterator over input rows. Not thread-safe.
     */
    public static class RecordCursor implements Iterator<PaymentRecord>, Closeable {

        private final MappingIterator<PaymentRecord> rows;
        private final Reader input;

        private RecordCursor(MappingIterator<PaymentRecord> rows, Reader input) {
            this.rows = rows;
            this.input = input;
        }

        @Override
        public boolean hasNext() {
            try {
                return rows.hasNextValue();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read CSV input", e);
            }
        }

        /**
         * @throws MalformedRecordException if the current row is not a readable record
         */
        @Override
        public PaymentRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            PaymentRecord record;
            try {
                record = rows.nextValue();
            } catch (JsonProcessingException e) {
                throw new MalformedRecordException(currentLine(), e.getOriginalMessage(), e);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read CSV input", e);
            }
            return checkIds(record);
        }

        private PaymentRecord checkIds(PaymentRecord record) {
            if (record.getClient() == null || record.getTx() == null) {
                throw new MalformedRecordException(currentLine(), "client and tx are required");
            }
            if (record.getClient() < 0 || record.getClient() > MAX_CLIENT_ID) {
                throw new MalformedRecordException(currentLine(),
                    String.format("client id %d out of range", record.getClient()));
            }
            if (record.getTx() < 0 || record.getTx() > MAX_TX_ID) {
                throw new MalformedRecordException(currentLine(),
                    String.format("tx id %d out of range", record.getTx()));
            }
            return record;
        }

        private long currentLine() {
            return rows.getCurrentLocation().getLineNr();
        }

        @Override
        public void close() throws IOException {
            try {
                rows.close();
            } finally {
                input.close();
            }
        }
    }
}
