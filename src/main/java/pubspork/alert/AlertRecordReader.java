package pubspork.alert;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import pubspork.beans.RawPublicationBean;
import pubspork.model.exception.AlertReadException;

/**
 * <p><b><i>Reads alert records that the email adapters have already pulled out of alert
 * messages. The file is a JSON array with one object per reported publication.<p><b><i>
 */
@Slf4j
@Component
public class AlertRecordReader {

    private final ObjectMapper objectMapper;

    @Autowired
    public AlertRecordReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return selected records in file order
     * @throws AlertReadException if the file cannot be read
     */
    public List<RawPublicationBean> read(Path path, AlertSelection selection) {
        List<RawPublicationBean> records;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            records = this.objectMapper.readValue(reader, new TypeReference<List<RawPublicationBean>>() {});
        } catch (IOException e) {
            throw new AlertReadException("Unable to read alert records " + path, e);
        }
        List<RawPublicationBean> selected = new ArrayList<>();
        for (RawPublicationBean record : records) {
            AlertSource source;
            try {
                source = AlertSource.fromValue(record.getOrigin());
            } catch (IllegalArgumentException e) {
                log.warn("Skipping alert record '" + record.getTitle() + "': " + e.getMessage());
                continue;
            }
            if (selection.accepts(source, record.getAlertDate())) {
                selected.add(record);
            }
        }
        log.info("Selected " + selected.size() + " of " + records.size() + " alert records from " + path
                + " for " + selection);
        return selected;
    }
}
