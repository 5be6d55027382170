package pubspork.report;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TagCountBean {

    private String tag;
    private int count;
    /** Only in the tag by year report, every year of the library in order. */
    private Map<String, Integer> countsByYear;
}
