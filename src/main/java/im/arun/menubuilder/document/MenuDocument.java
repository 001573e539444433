package im.arun.menubuilder.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * The persisted form of a menu: an ordered list of top-level entries.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MenuDocument {

    public static final int CURRENT_FORMAT_VERSION = 1;

    @JsonProperty("name")
    private String name;

    @JsonProperty("format_version")
    private Integer formatVersion;

    @JsonProperty("next_id")
    private Long nextId;

    @JsonProperty("items")
    private List<MenuItemEntry> items;
}
