package pubspork.report;

import java.time.LocalDate;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Publications added to the library between two dates, both included.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TagCountDateRangeBean {

    private LocalDate entryStartDate;
    private LocalDate entryEndDate;
    private int publicationCount;
    private List<TagCountBean> tags;
}
