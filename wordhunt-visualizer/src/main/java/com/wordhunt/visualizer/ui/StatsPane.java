package com.wordhunt.visualizer.ui;

import com.wordhunt.visualizer.model.SolveFrame;
import javafx.geometry.Insets;
import javafx.scene.Node;
import javafx.scene.control.Label;
import javafx.scene.layout.GridPane;
import javafx.scene.layout.VBox;

/**
 * Displays aggregated information about the latest solve.
 */
public final class StatsPane extends VBox {

    private final Label dictionaryValue = valueLabel();
    private final Label dictionarySizeValue = valueLabel();
    private final Label gridValue = valueLabel();
    private final Label foundValue = valueLabel();
    private final Label shownValue = valueLabel();
    private final Label nodesValue = valueLabel();
    private final Label timeValue = valueLabel();
    private final Label timeoutValue = valueLabel();
    private final Label selectedValue = valueLabel();

    public StatsPane() {
        setPadding(new Insets(16));
        setSpacing(12);
        setStyle("-fx-background-color: rgba(255,255,255,0.85); -fx-border-color: #d0d6e6; -fx-border-radius: 6; -fx-background-radius: 6;");
        setPrefWidth(280);
        setMinWidth(280);

        Label title = new Label("Statistics");
        title.setStyle("-fx-font-size: 18px; -fx-font-weight: bold;");

        GridPane grid = new GridPane();
        grid.setHgap(10);
        grid.setVgap(8);

        addRow(grid, 0, "Dictionary", dictionaryValue);
        addRow(grid, 1, "Dictionary words", dictionarySizeValue);
        addRow(grid, 2, "Grid", gridValue);
        addRow(grid, 3, "Words found", foundValue);
        addRow(grid, 4, "Words shown", shownValue);
        addRow(grid, 5, "Visited nodes", nodesValue);
        addRow(grid, 6, "Solve time", timeValue);
        addRow(grid, 7, "Timed out", timeoutValue);
        addRow(grid, 8, "Selected path", selectedValue);

        getChildren().addAll(title, grid);
    }

    public void update(SolveFrame frame) {
        if (frame == null) {
            dictionaryValue.setText("—");
            dictionarySizeValue.setText("—");
            gridValue.setText("—");
            foundValue.setText("—");
            shownValue.setText("—");
            nodesValue.setText("—");
            timeValue.setText("—");
            timeoutValue.setText("—");
            selectedValue.setText("—");
            return;
        }

        dictionaryValue.setText(frame.dictionaryLabel());
        dictionarySizeValue.setText(String.format("%,d", frame.trie().size()));
        gridValue.setText(frame.grid().rows() + " × " + frame.grid().cols());
        foundValue.setText(String.format("%,d", frame.foundCount()));
        shownValue.setText(String.format("%,d", frame.shownCount()));
        nodesValue.setText(String.format("%,d", frame.result().visitedNodes()));
        timeValue.setText(String.format("%.1f ms", frame.result().elapsedMillis()));
        timeoutValue.setText(frame.result().timedOut() ? "Yes" : "No");
        selectedValue.setText("—");
    }

    public void showSelectedPath(String formattedPath) {
        selectedValue.setText(formattedPath == null || formattedPath.isEmpty() ? "—" : formattedPath);
    }

    private static void addRow(GridPane grid, int row, String label, Node value) {
        Label caption = new Label(label + ":");
        caption.setStyle("-fx-text-fill: #4a4f64; -fx-font-weight: 600;");
        grid.addRow(row, caption, value);
    }

    private static Label valueLabel() {
        Label label = new Label("—");
        label.setStyle("-fx-font-size: 14px; -fx-text-fill: #1f2333;");
        label.setWrapText(true);
        return label;
    }
}
