package com.barvault.dataservice.store;

import com.barvault.core.model.Bar;
import com.barvault.core.model.BarType;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.msgpack.core.MessagePackException;
import org.msgpack.jackson.dataformat.MessagePackFactory;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Columnar MessagePack encoding of a partition file: a header followed by one array per column.
 * Prices are kept as decimal strings so their scale survives the round trip.
 */
public class PartitionCodec {

    public record PartitionHeader(String barType, long writtenAtNs, int rowCount) {}

    public record PartitionDocument(
        PartitionHeader header,
        long[] eventTimeNs,
        long[] ingestTimeNs,
        String[] open,
        String[] high,
        String[] low,
        String[] close,
        long[] volume
    ) {}

    public record PartitionContent(PartitionHeader header, List<Bar> bars) {}

    private final ObjectMapper msgpackMapper;

    public PartitionCodec() {
        this.msgpackMapper = new ObjectMapper(new MessagePackFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public byte[] encode(BarType barType, List<Bar> bars, long writtenAtNs) throws IOException {
        int n = bars.size();
        long[] eventTimes = new long[n];
        long[] ingestTimes = new long[n];
        String[] open = new String[n];
        String[] high = new String[n];
        String[] low = new String[n];
        String[] close = new String[n];
        long[] volume = new long[n];

        for (int i = 0; i < n; i++) {
            Bar bar = bars.get(i);
            eventTimes[i] = bar.eventTimeNs();
            ingestTimes[i] = bar.ingestTimeNs();
            open[i] = bar.open().toPlainString();
            high[i] = bar.high().toPlainString();
            low[i] = bar.low().toPlainString();
            close[i] = bar.close().toPlainString();
            volume[i] = bar.volume();
        }

        PartitionDocument doc = new PartitionDocument(
            new PartitionHeader(barType.toString(), writtenAtNs, n),
            eventTimes, ingestTimes, open, high, low, close, volume);
        return msgpackMapper.writeValueAsBytes(doc);
    }

    /**
     * Decode a whole partition file.
     *
     * @throws IOException if the file cannot be read or is structurally invalid
     */
    public PartitionContent read(Path file) throws IOException {
        PartitionDocument doc;
        try (InputStream in = Files.newInputStream(file)) {
            doc = msgpackMapper.readValue(in, PartitionDocument.class);
        } catch (MessagePackException e) {
            throw new IOException("Malformed partition: " + e.getMessage(), e);
        }
        PartitionHeader header = doc.header();
        if (header == null) {
            throw new IOException("Partition has no header");
        }
        int n = header.rowCount();
        if (!columnsHaveLength(doc, n)) {
            throw new IOException("Column lengths do not match row count " + n);
        }

        List<Bar> bars = new ArrayList<>(n);
        try {
            BarType barType = BarType.parse(header.barType());
            for (int i = 0; i < n; i++) {
                bars.add(new Bar(barType,
                    new BigDecimal(doc.open()[i]),
                    new BigDecimal(doc.high()[i]),
                    new BigDecimal(doc.low()[i]),
                    new BigDecimal(doc.close()[i]),
                    doc.volume()[i],
                    doc.eventTimeNs()[i],
                    doc.ingestTimeNs()[i]));
            }
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid bar data: " + e.getMessage(), e);
        }
        return new PartitionContent(header, bars);
    }

    /**
     * Read only the header, skipping the column arrays.
     */
    public PartitionHeader readHeader(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file);
             JsonParser parser = msgpackMapper.getFactory().createParser(in)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new IOException("Partition is not a document");
            }
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String name = parser.currentName();
                parser.nextToken();
                if ("header".equals(name)) {
                    return msgpackMapper.readValue(parser, PartitionHeader.class);
                }
                parser.skipChildren();
            }
        } catch (MessagePackException e) {
            throw new IOException("Malformed partition header: " + e.getMessage(), e);
        }
        throw new IOException("Partition has no header");
    }

    private static boolean columnsHaveLength(PartitionDocument doc, int n) {
        return doc.eventTimeNs() != null && doc.eventTimeNs().length == n
            && doc.ingestTimeNs() != null && doc.ingestTimeNs().length == n
            && doc.open() != null && doc.open().length == n
            && doc.high() != null && doc.high().length == n
            && doc.low() != null && doc.low().length == n
            && doc.close() != null && doc.close().length == n
            && doc.volume() != null && doc.volume().length == n;
    }
}
