package com.repo.treemap.report;

import com.repo.treemap.core.LabelFormatter;
import com.repo.treemap.tree.TreemapResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a standalone HTML page drawing the nested treemap with d3.
 */
public class HtmlReporter {

    private final HierarchyJsonConverter converter = new HierarchyJsonConverter();

    public boolean generate(TreemapResult result, String valueColumn, String baseTitle, Path outputPath) {
        String html = render(result, valueColumn, baseTitle);

        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null)
                Files.createDirectories(parent);
            Files.writeString(outputPath, html);
            System.out.println("Report generated at: " + outputPath.toAbsolutePath());
            return true;
        } catch (IOException e) {
            System.err.println("Error: Could not write HTML report to " + outputPath + ": " + e.getMessage());
            return false;
        }
    }

    String render(TreemapResult result, String valueColumn, String baseTitle) {
        String treemapJson = converter.convertToHierarchyJson(result, valueColumn);
        String title = chartTitle(baseTitle, valueColumn);

        return TEMPLATE
                .replace("{{TITLE}}", escapeHtml(title))
                .replace("{{TOTAL}}", escapeHtml(LabelFormatter.formatValue(result.total())))
                .replace("{{VALUE_COLUMN}}", escapeHtml(valueColumn))
                .replace("{{LEAF_COUNT}}", String.valueOf(result.leaves().size()))
                .replace("{{TREEMAP_DATA}}", treemapJson);
    }

    static String chartTitle(String baseTitle, String valueColumn) {
        return baseTitle + ": " + valueColumn;
    }

    private static String escapeHtml(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }

    private static final String TEMPLATE = """
            <!DOCTYPE html>
            <html>
            <head>
                <meta charset="utf-8">
                <title>{{TITLE}}</title>
                <script src="https://d3js.org/d3.v7.min.js"></script>
                <style>
                    * { box-sizing: border-box; }
                    body { font-family: 'Segoe UI', Tahoma, Geneva, Verdana, sans-serif; margin: 0; padding: 50px 25px 25px 25px; background: #f4f7f6; }
                    h1 { color: #2c3e50; margin: 0 0 6px 0; font-size: 1.4rem; }
                    .subtitle { color: #7f8c8d; margin-bottom: 14px; font-size: 0.9rem; }
                    #breadcrumbs { font-size: 0.9rem; padding: 8px 14px; background: #2c3e50; color: #ecf0f1; border-radius: 16px; margin-bottom: 10px; display: inline-block; }
                    #breadcrumbs span { cursor: pointer; }
                    #breadcrumbs span:hover { text-decoration: underline; }
                    #treemap { width: 100%; height: 80vh; display: block; background: white; border-radius: 8px; box-shadow: 0 2px 10px rgba(0,0,0,0.1); }
                    .cell rect { stroke: #fff; stroke-width: 1px; cursor: pointer; }
                    .cell:hover rect { stroke: #2c3e50; stroke-width: 2px; }
                    .cell text { font: 11px "Helvetica Neue", Helvetica, Arial, sans-serif; fill: #1a1a2e; pointer-events: none; }
                    .cell .group-label { font-weight: bold; }
                    .tooltip { position: absolute; pointer-events: none; background: rgba(44, 62, 80, 0.95); color: #fff; padding: 8px 12px; border-radius: 6px; font-size: 12px; line-height: 1.5; opacity: 0; }
                </style>
            </head>
            <body>
                <h1>{{TITLE}}</h1>
                <div class="subtitle">Total {{VALUE_COLUMN}}: {{TOTAL}} &middot; {{LEAF_COUNT}} categories</div>
                <div id="breadcrumbs"></div>
                <svg id="treemap"></svg>
                <script>
                    const treemapData = {{TREEMAP_DATA}};

                    const tooltip = d3.select('body').append('div').attr('class', 'tooltip');
                    const color = d3.scaleOrdinal(d3.schemeTableau10);

                    function topLevelName(d) {
                        let node = d;
                        while (node.depth > 1) node = node.parent;
                        return node.data.name;
                    }

                    function renderTreemap(focusId) {
                        const svgEl = document.getElementById('treemap');
                        const width = svgEl.clientWidth || window.innerWidth - 50;
                        const height = svgEl.clientHeight || window.innerHeight * 0.8;

                        // Own values on interior nodes count towards their area
                        const root = d3.hierarchy(treemapData)
                            .sum(d => d.value || 0)
                            .sort((a, b) => b.value - a.value);

                        let focus = root;
                        if (focusId) {
                            focus = root.descendants().find(d => d.data.id === focusId) || root;
                        }
                        const view = focus.copy();

                        d3.treemap()
                            .size([width, height])
                            .paddingOuter(3)
                            .paddingTop(d => d === view ? 3 : 18)
                            .paddingInner(2)
                            .round(true)(view);

                        const svg = d3.select('#treemap');
                        svg.selectAll('*').remove();
                        svg.attr('width', width).attr('height', height);

                        const cell = svg.selectAll('g')
                            .data(view.descendants().filter(d => d !== view))
                            .join('g')
                            .attr('class', 'cell')
                            .attr('transform', d => `translate(${d.x0},${d.y0})`);

                        cell.append('rect')
                            .attr('width', d => Math.max(0, d.x1 - d.x0))
                            .attr('height', d => Math.max(0, d.y1 - d.y0))
                            .attr('fill', d => {
                                const base = d3.color(color(topLevelName(d)));
                                return d.children ? base.brighter(1.2) : base;
                            })
                            .on('mouseover', (event, d) => {
                                tooltip.html(d.data.hover).style('opacity', 1);
                            })
                            .on('mousemove', (event) => {
                                tooltip.style('left', (event.pageX + 12) + 'px').style('top', (event.pageY + 12) + 'px');
                            })
                            .on('mouseout', () => tooltip.style('opacity', 0))
                            .on('click', (event, d) => {
                                event.stopPropagation();
                                const target = d.children ? d : d.parent;
                                renderTreemap(target && target !== view ? target.data.id : (focus.parent ? focus.parent.data.id : null));
                            });

                        cell.append('text')
                            .attr('class', d => d.children ? 'group-label' : 'leaf-label')
                            .attr('x', 4)
                            .attr('y', 13)
                            .text(d => {
                                const w = d.x1 - d.x0;
                                const h = d.y1 - d.y0;
                                if (w < 60 || h < 16) return '';
                                const label = d.data.label;
                                const maxChars = Math.floor(w / 6.5);
                                return label.length > maxChars ? label.substring(0, Math.max(0, maxChars - 3)) + '...' : label;
                            });

                        updateBreadcrumbs(focus);
                    }

                    function updateBreadcrumbs(focus) {
                        const trail = focus.ancestors().reverse();
                        const crumbs = d3.select('#breadcrumbs');
                        crumbs.selectAll('*').remove();
                        trail.forEach((d, i) => {
                            if (i > 0) crumbs.append('text').text(' > ');
                            crumbs.append('span')
                                .text(d.data.name)
                                .on('click', () => renderTreemap(d.depth === 0 ? null : d.data.id));
                        });
                    }

                    let resizeTimeout = null;
                    window.addEventListener('resize', () => {
                        clearTimeout(resizeTimeout);
                        resizeTimeout = setTimeout(() => renderTreemap(null), 250);
                    });

                    renderTreemap(null);
                </script>
            </body>
            </html>
            """;
}
