package com.flagship.payment_processor.io;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.payment_processor.ledger.ClientBalance;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the final balances as CSV: {@code client,available,held,total,locked}.
 */
@Component
@RequiredArgsConstructor
public class BalanceReportWriter {

    private final CsvMapper csvMapper;

    /**
     * Writes the header and one row per balance. The output is flushed, not closed.
     *
     * @param balances rows to write, already scaled for display
     * @param output destination
     */
    public void write(List<ClientBalance> balances, Writer output) {
        CsvSchema schema = csvMapper.schemaFor(ClientBalance.class).withHeader();
        if (balances.isEmpty()) {
            writeHeader(schema, output);
            return;
        }
        try (SequenceWriter rows = csvMapper.writer(schema).writeValues(output)) {
            rows.writeAll(balances);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write balance report", e);
        }
    }

    // The generator only emits the header along with the first row
    private void writeHeader(CsvSchema schema, Writer output) {
        List<String> names = new ArrayList<>();
        schema.forEach(column -> names.add(column.getName()));
        try {
            output.write(String.join(String.valueOf(schema.getColumnSeparator()), names));
            output.write(schema.getLineSeparator());
            output.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write balance report", e);
        }
    }
}
