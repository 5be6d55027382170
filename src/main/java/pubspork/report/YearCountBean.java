package pubspork.report;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class YearCountBean {

    /** Publication year, or {@code unknown}. */
    private String year;
    private int count;
}
