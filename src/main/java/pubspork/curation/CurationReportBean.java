package pubspork.curation;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything the curation page renderer needs from one run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CurationReportBean {

    private LocalDate runDate;
    /** Publications per classification, ignored ones included. */
    private Map<String, Integer> counts;
    private int skippedRecords;
    private int libraryDuplicates;
    private List<CurationItemBean> items;
}
