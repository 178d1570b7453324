package org.pragmatica.widgets.extract;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Table of recognized constructors: widget kinds and value-object kinds, each with the ordered
 * property names its positional arguments map to.
 *
 * <p>Dotted names are named constructors and are matched exactly: {@code Image.asset} is a
 * widget because it is registered, while {@code Theme.of} is not although {@code Theme} is.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class WidgetCatalog {

    private static final WidgetCatalog BUILT_IN = builder().withBuiltIns().build();

    private final Map<String, WidgetKind> widgets;
    private final Map<String, ValueKind> values;

    private WidgetCatalog(Map<String, WidgetKind> widgets, Map<String, ValueKind> values) {
        this.widgets = Map.copyOf(widgets);
        this.values = Map.copyOf(values);
    }

    /**
     * The catalog of common Material and Cupertino widgets and value types.
     */
    public static WidgetCatalog builtIn() {
        return BUILT_IN;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<WidgetKind> widget(String name) {
        return Optional.ofNullable(widgets.get(name));
    }

    public Optional<ValueKind> value(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean isWidget(String name) {
        return widget(name).isPresent();
    }

    public boolean isValue(String name) {
        return value(name).isPresent();
    }

    public int widgetCount() {
        return widgets.size();
    }

    public int valueCount() {
        return values.size();
    }

    /**
     * Builder for catalogs. Later registrations replace earlier ones with the same name.
     */
    public static final class Builder {
        private final Map<String, WidgetKind> widgets = new LinkedHashMap<>();
        private final Map<String, ValueKind> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder widget(String name, WidgetCategory category, String... positionalSlots) {
            Objects.requireNonNull(name, "name");
            values.remove(name);
            widgets.put(name, new WidgetKind(name, category, List.of(positionalSlots)));
            return this;
        }

        public Builder value(String name, String... positionalSlots) {
            Objects.requireNonNull(name, "name");
            widgets.remove(name);
            values.put(name, new ValueKind(name, List.of(positionalSlots)));
            return this;
        }

        public Builder from(WidgetCatalog catalog) {
            widgets.putAll(catalog.widgets);
            values.putAll(catalog.values);
            return this;
        }

        public Builder withBuiltIns() {
            layouts("Row", "Column", "Stack", "Wrap", "Flex", "ListView", "GridView", "IndexedStack",
                    "ListBody", "Table", "TableRow", "ButtonBar", "OverflowBar", "CustomScrollView",
                    "SliverList", "SliverGrid", "PageView");
            containers("Container", "Center", "Align", "SizedBox", "Expanded", "Flexible", "Card",
                       "SingleChildScrollView", "Positioned", "Opacity", "ClipRRect", "ClipOval", "ClipRect",
                       "DecoratedBox", "ConstrainedBox", "LimitedBox", "AspectRatio", "FittedBox", "SafeArea",
                       "Material", "InkWell", "GestureDetector", "Hero", "Transform", "Visibility", "Semantics",
                       "Tooltip", "Form", "FractionallySizedBox", "IntrinsicHeight", "IntrinsicWidth",
                       "AnimatedContainer", "AnimatedOpacity", "Dismissible", "Draggable", "Baseline",
                       "DefaultTextStyle", "Theme", "MediaQuery", "RefreshIndicator", "Scrollbar",
                       "SliverToBoxAdapter", "SliverPadding");
            widget("Padding", WidgetCategory.CONTAINER, "padding");
            widget("SizedBox.expand", WidgetCategory.CONTAINER, "child");
            widget("SizedBox.square", WidgetCategory.CONTAINER, "dimension");
            widget("SizedBox.shrink", WidgetCategory.DISPLAY);
            widget("Positioned.fill", WidgetCategory.CONTAINER);
            widget("Positioned.directional", WidgetCategory.CONTAINER);
            widget("Positioned.fromRect", WidgetCategory.CONTAINER);
            widget("ListView.builder", WidgetCategory.LAYOUT);
            widget("ListView.separated", WidgetCategory.LAYOUT);
            widget("GridView.count", WidgetCategory.LAYOUT);
            widget("GridView.builder", WidgetCategory.LAYOUT);

            widget("Text", WidgetCategory.TEXT, "text");
            widget("Text.rich", WidgetCategory.TEXT, "textSpan");
            widget("SelectableText", WidgetCategory.TEXT, "text");
            widget("RichText", WidgetCategory.TEXT);

            widget("Icon", WidgetCategory.ICON, "icon");
            widget("ImageIcon", WidgetCategory.ICON, "image");

            widget("Image", WidgetCategory.IMAGE);
            widget("Image.asset", WidgetCategory.IMAGE, "name");
            widget("Image.network", WidgetCategory.IMAGE, "src");
            widget("Image.file", WidgetCategory.IMAGE, "file");
            widget("CircleAvatar", WidgetCategory.IMAGE);
            widget("FlutterLogo", WidgetCategory.IMAGE);

            for (var name : List.of("ElevatedButton", "TextButton", "OutlinedButton", "IconButton",
                                    "FloatingActionButton", "CupertinoButton", "MaterialButton",
                                    "PopupMenuButton", "BackButton", "CloseButton")) {
                widget(name, WidgetCategory.BUTTON);
            }
            widget("ElevatedButton.icon", WidgetCategory.BUTTON);
            widget("TextButton.icon", WidgetCategory.BUTTON);
            widget("OutlinedButton.icon", WidgetCategory.BUTTON);
            widget("FloatingActionButton.extended", WidgetCategory.BUTTON);
            widget("CupertinoButton.filled", WidgetCategory.BUTTON);

            for (var name : List.of("TextField", "TextFormField", "Checkbox", "Switch", "Slider", "Radio",
                                    "DropdownButton", "DropdownMenuItem", "CupertinoTextField",
                                    "CupertinoSwitch", "CupertinoSlider", "CheckboxListTile",
                                    "SwitchListTile", "RadioListTile")) {
                widget(name, WidgetCategory.INPUT);
            }

            for (var name : List.of("MaterialApp", "CupertinoApp", "Scaffold", "AppBar", "Drawer",
                                    "BottomNavigationBar", "NavigationBar", "TabBar", "TabBarView", "Tab",
                                    "CupertinoPageScaffold", "CupertinoNavigationBar", "CupertinoTabScaffold",
                                    "ListTile", "SnackBar", "AlertDialog", "SimpleDialog", "BottomSheet",
                                    "DrawerHeader", "SliverAppBar", "DefaultTabController")) {
                widget(name, WidgetCategory.NAVIGATION);
            }

            for (var name : List.of("Divider", "VerticalDivider", "Spacer", "Placeholder",
                                    "CircularProgressIndicator", "LinearProgressIndicator",
                                    "CupertinoActivityIndicator", "Chip", "Badge")) {
                widget(name, WidgetCategory.DISPLAY);
            }

            for (var name : List.of("TextStyle", "BoxDecoration", "ShapeDecoration", "InputDecoration",
                                    "EdgeInsets.symmetric", "EdgeInsets.only", "EdgeInsetsDirectional.only",
                                    "EdgeInsetsDirectional.symmetric", "BorderRadius.only", "BorderRadius.vertical",
                                    "BorderRadius.horizontal", "Border.all", "Border.symmetric", "Border",
                                    "BorderSide", "BoxShadow", "BoxConstraints", "BoxConstraints.expand",
                                    "BoxConstraints.tightFor", "Duration", "LinearGradient", "RadialGradient",
                                    "RoundedRectangleBorder", "CircleBorder", "StadiumBorder", "OutlineInputBorder",
                                    "UnderlineInputBorder", "GlobalKey", "TextSpan", "IconThemeData", "ThemeData",
                                    "ColorScheme.fromSeed", "ColorScheme.light", "ColorScheme.dark",
                                    "TextEditingController", "ScrollController", "BottomNavigationBarItem",
                                    "NavigationDestination", "ButtonStyle", "DecorationImage",
                                    "SliverGridDelegateWithFixedCrossAxisCount",
                                    "CupertinoThemeData", "Shadow", "FontFeature", "TextTheme")) {
                value(name);
            }
            value("EdgeInsets.all", "all");
            value("EdgeInsets.fromLTRB", "left", "top", "right", "bottom");
            value("EdgeInsetsDirectional.fromSTEB", "start", "top", "end", "bottom");
            value("Color", "value");
            value("Color.fromARGB", "a", "r", "g", "b");
            value("Color.fromRGBO", "r", "g", "b", "opacity");
            value("Offset", "dx", "dy");
            value("Size", "width", "height");
            value("Size.square", "dimension");
            value("Radius.circular", "radius");
            value("Radius.elliptical", "x", "y");
            value("BorderRadius.circular", "radius");
            value("BorderRadius.all", "radius");
            value("Alignment", "x", "y");
            value("Key", "value");
            value("ValueKey", "value");
            value("Locale", "languageCode", "countryCode");
            value("AssetImage", "assetName");
            value("NetworkImage", "url");
            return this;
        }

        private void layouts(String... names) {
            for (var name : names) {
                widget(name, WidgetCategory.LAYOUT, "children");
            }
        }

        private void containers(String... names) {
            for (var name : names) {
                widget(name, WidgetCategory.CONTAINER, "child");
            }
        }

        public WidgetCatalog build() {
            return new WidgetCatalog(widgets, values);
        }
    }
}
