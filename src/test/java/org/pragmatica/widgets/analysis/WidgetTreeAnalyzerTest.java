package org.pragmatica.widgets.analysis;

import org.junit.jupiter.api.Test;
import org.pragmatica.widgets.WidgetTreeParser;
import org.pragmatica.widgets.extract.PropertyValue;
import org.pragmatica.widgets.extract.Widget;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WidgetTreeAnalyzerTest {

    private static final String SCREEN = """
        Scaffold(
          appBar: AppBar(title: Text('Inbox')),
          body: Column(children: [
            Text('Unread', style: TextStyle(fontSize: 18)),
            Row(children: [Icon(Icons.mail), Text('3 new')]),
          ]),
        )
        """;

    private static List<Widget> roots(String source) {
        return WidgetTreeParser.create().convert(source).roots();
    }

    @Test
    void analyze_singleTree_reportsDepthAndSize() {
        var analysis = WidgetTreeAnalyzer.analyze(roots(SCREEN));

        assertThat(analysis.trees()).hasSize(1);
        var stats = analysis.trees().get(0);
        assertThat(stats.root().type()).isEqualTo("Scaffold");
        assertThat(stats.depth()).isEqualTo(4);
        assertThat(stats.nodeCount()).isEqualTo(8);
        assertThat(analysis.totalWidgets()).isEqualTo(8);
        assertThat(analysis.maxDepth()).isEqualTo(4);
    }

    @Test
    void locations_recordTypePathAndIndexes() {
        var analysis = WidgetTreeAnalyzer.analyze(roots(SCREEN));
        var mail = analysis.findByType("Icon").get(0);

        var location = analysis.location(mail.id()).orElseThrow();

        assertThat(location.typePath()).containsExactly("Scaffold", "Column", "Row", "Icon");
        assertThat(location.indexPath()).containsExactly(1, 1, 0);
        assertThat(location.depth()).isEqualTo(3);
        assertThat(location.siblingIndex()).isZero();
        assertThat(location.describe()).isEqualTo("Scaffold > Column > Row > Icon");
        assertThat(location.isRoot()).isFalse();
    }

    @Test
    void ancestors_areNearestFirst() {
        var analysis = WidgetTreeAnalyzer.analyze(roots(SCREEN));
        var mail = analysis.findByType("Icon").get(0);

        assertThat(analysis.ancestors(mail.id())).extracting(Widget::type)
                                                 .containsExactly("Row", "Column", "Scaffold");
    }

    @Test
    void siblings_excludeWidgetItself() {
        var analysis = WidgetTreeAnalyzer.analyze(roots(SCREEN));
        var mail = analysis.findByType("Icon").get(0);
        var root = analysis.trees().get(0).root();

        assertThat(analysis.siblings(mail.id())).extracting(Widget::type).containsExactly("Text");
        assertThat(analysis.siblings(root.id())).isEmpty();
    }

    @Test
    void widgetAt_followsChildIndexes() {
        var analysis = WidgetTreeAnalyzer.analyze(roots(SCREEN));

        assertThat(analysis.widgetAt(0, List.of(1, 1)).map(Widget::type)).contains("Row");
        assertThat(analysis.widgetAt(0, List.of()).map(Widget::type)).contains("Scaffold");
        assertThat(analysis.widgetAt(0, List.of(5))).isEmpty();
        assertThat(analysis.widgetAt(1, List.of())).isEmpty();
    }

    @Test
    void containersAndLeaves_partitionByChildren() {
        var analysis = WidgetTreeAnalyzer.analyze(roots(SCREEN));

        assertThat(analysis.containers()).extracting(Widget::type)
                                         .containsExactly("Scaffold", "AppBar", "Column", "Row");
        assertThat(analysis.leaves()).hasSize(4);
    }

    @Test
    void findByProperty_matchesNameAndValue() {
        var analysis = WidgetTreeAnalyzer.analyze(roots(SCREEN));

        assertThat(analysis.findByProperty("text")).hasSize(3);
        assertThat(analysis.findByProperty("text", PropertyValue.Literal.of("3 new"))).hasSize(1);
        assertThat(analysis.findByProperty("style")).hasSize(1);
    }

    @Test
    void analyze_severalRoots_keepsPerTreeStats() {
        var analysis = WidgetTreeAnalyzer.analyze(roots("Text('a'); Center(child: Text('b'))"));

        assertThat(analysis.trees()).extracting(TreeAnalysis.TreeStats::depth).containsExactly(1, 2);
        assertThat(analysis.totalWidgets()).isEqualTo(3);
        assertThat(analysis.location(analysis.trees().get(1).root().id()))
            .hasValueSatisfying(location -> assertThat(location.isRoot()).isTrue());
    }

    @Test
    void analyze_deepTree_countsEveryLevel() {
        var parser = WidgetTreeParser.builder().maxDepth(200).build();
        var source = "Center(child: ".repeat(150) + "Text('x')" + ")".repeat(150);

        var analysis = WidgetTreeAnalyzer.analyze(parser.convert(source).roots());

        assertThat(analysis.totalWidgets()).isEqualTo(151);
        assertThat(analysis.maxDepth()).isEqualTo(151);
    }
}
