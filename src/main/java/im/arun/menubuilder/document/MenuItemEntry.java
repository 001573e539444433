package im.arun.menubuilder.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One persisted menu entry. Kind-specific fields are left out when they do not
 * apply; the display path is never stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MenuItemEntry {

    @JsonProperty("id")
    private Long id;

    @JsonProperty("kind")
    private String kind;

    @JsonProperty("label")
    private String label;

    @JsonProperty("language")
    private String language;

    @JsonProperty("command")
    private String command;

    @JsonProperty("icon")
    private String icon;

    @JsonProperty("option_box")
    private Boolean optionBox;

    @JsonProperty("children")
    private List<MenuItemEntry> children;
}
