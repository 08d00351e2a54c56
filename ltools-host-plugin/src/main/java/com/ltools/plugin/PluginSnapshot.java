package com.ltools.plugin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only view of a registered plugin as the UI sees it. Serializable with Jackson.
 */
@JsonPropertyOrder({"id", "name", "icon", "state", "hasPage", "showInMenu", "type", "version", "keywords"})
public final class PluginSnapshot {

    private final String id;
    private final String name;
    private final String icon;
    private final PluginState state;
    private final boolean hasPage;
    private final boolean showInMenu;
    private final PluginType type;
    private final String version;
    private final Set<String> keywords;

    @JsonCreator
    public PluginSnapshot(@JsonProperty("id") String id,
                          @JsonProperty("name") String name,
                          @JsonProperty("icon") String icon,
                          @JsonProperty("state") PluginState state,
                          @JsonProperty("hasPage") boolean hasPage,
                          @JsonProperty("showInMenu") boolean showInMenu,
                          @JsonProperty("type") PluginType type,
                          @JsonProperty("version") String version,
                          @JsonProperty("keywords") Set<String> keywords) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name != null ? name : id;
        this.icon = icon != null ? icon : "";
        this.state = state != null ? state : PluginState.INSTALLED;
        this.hasPage = hasPage;
        this.showInMenu = showInMenu;
        this.type = type != null ? type : PluginType.EXTERNAL;
        this.version = version != null ? version : "";
        this.keywords = keywords != null ? Collections.unmodifiableSet(new LinkedHashSet<>(keywords)) : Set.of();
    }

    public static PluginSnapshot of(PluginMetadata m, PluginRuntimeState rs) {
        return new PluginSnapshot(m.getId(), m.getName(), m.getIcon(), rs.state(), rs.hasPage(), rs.showInMenu(),
                m.getType(), m.getVersion(), m.getKeywords());
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("icon")
    public String getIcon() {
        return icon;
    }

    @JsonProperty("state")
    public PluginState getState() {
        return state;
    }

    @JsonProperty("hasPage")
    public boolean hasPage() {
        return hasPage;
    }

    @JsonProperty("showInMenu")
    public boolean showInMenu() {
        return showInMenu;
    }

    @JsonProperty("type")
    public PluginType getType() {
        return type;
    }

    @JsonProperty("version")
    public String getVersion() {
        return version;
    }

    @JsonProperty("keywords")
    public Set<String> getKeywords() {
        return keywords;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PluginSnapshot that = (PluginSnapshot) o;
        return hasPage == that.hasPage && showInMenu == that.showInMenu && id.equals(that.id)
                && name.equals(that.name) && icon.equals(that.icon) && state == that.state
                && type == that.type && version.equals(that.version) && keywords.equals(that.keywords);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, icon, state, hasPage, showInMenu, type, version, keywords);
    }

    @Override
    public String toString() {
        return "PluginSnapshot{" + id + ", " + state + ", hasPage=" + hasPage + ", showInMenu=" + showInMenu + "}";
    }
}
