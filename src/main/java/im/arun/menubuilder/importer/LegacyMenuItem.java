package im.arun.menubuilder.importer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of the older flat menu format, where nesting is given by a
 * slash-separated submenu path and ordering by a numeric order key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class LegacyMenuItem {

    @JsonProperty("sub_menu_path")
    private String subMenuPath;

    @JsonProperty("order")
    private Integer order;

    @JsonProperty("function_str")
    private String functionStr;

    @JsonProperty("menu_label")
    private String menuLabel;

    @JsonProperty("module_path")
    private String modulePath;

    @JsonProperty("icon_path")
    private String iconPath;

    @JsonProperty("is_option_box")
    private Boolean optionBox;

    @JsonProperty("is_divider")
    private Boolean divider;

    @JsonProperty("command_type")
    private String commandType;
}
