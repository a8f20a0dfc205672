package villagecompute.reports.api.types;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Email recipients of a report, stored as a JSON column on the schedule.
 */
public record RecipientsType(@JsonProperty("to") List<String> to, @JsonProperty("cc") List<String> cc,
        @JsonProperty("bcc") List<String> bcc) {

    public RecipientsType {
        to = to == null ? List.of() : List.copyOf(to);
        cc = cc == null ? List.of() : List.copyOf(cc);
        bcc = bcc == null ? List.of() : List.copyOf(bcc);
    }

    /**
     * Returns to, cc and bcc addresses in that order.
     */
    @JsonIgnore
    public List<String> all() {
        List<String> all = new ArrayList<>(to.size() + cc.size() + bcc.size());
        all.addAll(to);
        all.addAll(cc);
        all.addAll(bcc);
        return all;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return to.isEmpty() && cc.isEmpty() && bcc.isEmpty();
    }
}
