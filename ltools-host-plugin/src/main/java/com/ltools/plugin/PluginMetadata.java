package com.ltools.plugin;

import com.ltools.annotations.HostPlugin;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable identity and display data of a plugin, declared once at registration.
 * Build with {@link #builder(String)} or read it from a {@link HostPlugin} annotation.
 */
public final class PluginMetadata {

    private final String id;
    private final String name;
    private final String version;
    private final String author;
    private final String description;
    private final String icon;
    private final PluginType type;
    private final Set<String> keywords;
    private final boolean hasPage;
    private final boolean showInMenu;

    private PluginMetadata(Builder b) {
        this.id = b.id;
        this.name = b.name != null && !b.name.isBlank() ? b.name.trim() : b.id;
        this.version = b.version != null ? b.version : "1.0.0";
        this.author = b.author != null ? b.author : "";
        this.description = b.description != null ? b.description : "";
        this.icon = b.icon != null ? b.icon.trim() : "";
        this.type = b.type != null ? b.type : PluginType.EXTERNAL;
        this.keywords = Collections.unmodifiableSet(new LinkedHashSet<>(b.keywords));
        this.hasPage = b.hasPage;
        this.showInMenu = b.showInMenu;
    }

    /**
     * Starts a builder for the given id.
     *
     * @throws IllegalArgumentException if id is null or blank
     */
    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Reads metadata from the {@link HostPlugin} annotation on {@code pluginClass}.
     *
     * @throws IllegalArgumentException if the class is not annotated
     */
    public static PluginMetadata fromAnnotation(Class<?> pluginClass, PluginType type) {
        HostPlugin a = Objects.requireNonNull(pluginClass, "pluginClass").getAnnotation(HostPlugin.class);
        if (a == null) {
            throw new IllegalArgumentException(pluginClass.getName() + " is not annotated with @HostPlugin");
        }
        return builder(a.id())
                .name(a.name())
                .version(a.version())
                .author(a.author())
                .description(a.description())
                .icon(a.icon())
                .keywords(a.keywords())
                .hasPage(a.hasPage())
                .showInMenu(a.showInMenu())
                .type(type)
                .build();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getAuthor() {
        return author;
    }

    public String getDescription() {
        return description;
    }

    /** Icon key; empty when the plugin declares none. */
    public String getIcon() {
        return icon;
    }

    public PluginType getType() {
        return type;
    }

    public Set<String> getKeywords() {
        return keywords;
    }

    public boolean hasPage() {
        return hasPage;
    }

    public boolean showInMenu() {
        return showInMenu;
    }

    /** Case-insensitive substring match over name, description, author and keywords. */
    public boolean matches(String keyword) {
        if (keyword == null || keyword.isBlank()) return false;
        String k = keyword.trim().toLowerCase();
        if (name.toLowerCase().contains(k)
                || description.toLowerCase().contains(k)
                || author.toLowerCase().contains(k)) {
            return true;
        }
        for (String kw : keywords) {
            if (kw.toLowerCase().contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "PluginMetadata{id=" + id + ", name=" + name + ", version=" + version + ", type=" + type + "}";
    }

    public static final class Builder {
        private final String id;
        private String name;
        private String version;
        private String author;
        private String description;
        private String icon;
        private PluginType type;
        private final Set<String> keywords = new LinkedHashSet<>();
        private boolean hasPage = true;
        private boolean showInMenu = true;

        private Builder(String id) {
            Objects.requireNonNull(id, "id");
            if (id.isBlank()) {
                throw new IllegalArgumentException("Plugin id must be non-blank");
            }
            this.id = id.trim();
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder author(String author) {
            this.author = author;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder icon(String icon) {
            this.icon = icon;
            return this;
        }

        public Builder type(PluginType type) {
            this.type = type;
            return this;
        }

        public Builder keywords(String... keywords) {
            if (keywords != null) {
                Arrays.stream(keywords)
                        .filter(k -> k != null && !k.isBlank())
                        .map(String::trim)
                        .forEach(this.keywords::add);
            }
            return this;
        }

        public Builder hasPage(boolean hasPage) {
            this.hasPage = hasPage;
            return this;
        }

        public Builder showInMenu(boolean showInMenu) {
            this.showInMenu = showInMenu;
            return this;
        }

        public PluginMetadata build() {
            return new PluginMetadata(this);
        }
    }
}
