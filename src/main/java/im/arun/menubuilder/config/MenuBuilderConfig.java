package im.arun.menubuilder.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class MenuBuilderConfig {

    @JsonProperty("menu_items_dir")
    private String menuItemsDir = "menus";

    @JsonProperty("default_menu")
    private String defaultMenu = "TempBar";

    @JsonProperty("log_level")
    private String logLevel = "ERROR";

    @JsonProperty("log_modes")
    private List<String> logModes = new ArrayList<>(Arrays.asList("DEBUG", "INFO", "WARNING", "ERROR", "CRITICAL"));

    @JsonProperty("language")
    private String language = "en_us";

    @JsonProperty("language_modes")
    private List<String> languageModes = new ArrayList<>(Arrays.asList("zh_tw", "en_us", "ja_jp"));
}
