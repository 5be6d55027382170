package pubspork.report;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JournalCountBean {

    /** Journals with the same count share a rank. */
    private int rank;
    private String journal;
    private int count;
}
