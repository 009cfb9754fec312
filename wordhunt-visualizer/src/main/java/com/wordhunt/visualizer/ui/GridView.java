package com.wordhunt.visualizer.ui;

import com.wordhunt.core.Cell;
import com.wordhunt.core.Grid;
import com.wordhunt.core.WordPath;
import javafx.scene.Group;
import javafx.scene.layout.Pane;
import javafx.scene.paint.Color;
import javafx.scene.paint.Paint;
import javafx.scene.shape.Circle;
import javafx.scene.shape.Polyline;
import javafx.scene.shape.Rectangle;
import javafx.scene.shape.StrokeLineCap;
import javafx.scene.shape.StrokeLineJoin;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;
import javafx.scene.text.Text;

/**
 * Draws the letter grid and highlights the path of the selected word.
 */
public final class GridView extends Pane {

    private static final double CELL_SIZE = 72.0;
    private static final double CELL_GAP = 8.0;
    private static final double CORNER_RADIUS = 14.0;
    private static final Paint CELL_FILL = Color.web("#F3E3B5");
    private static final Paint PATH_FILL = Color.web("#8BC34A");
    private static final Paint START_FILL = Color.web("#4F6BED");
    private static final Paint CELL_STROKE = Color.rgb(170, 150, 110);
    private static final Paint LETTER_FILL = Color.rgb(31, 35, 51);
    private static final Paint PATH_STROKE = Color.web("#E57373", 0.85);
    private static final double PATH_THICKNESS = 8.0;

    private final Group content = new Group();
    private final Group cellGroup = new Group();
    private final Polyline pathLine = new Polyline();
    private final Circle startMarker = new Circle(CELL_SIZE * 0.18);

    private Grid grid;
    private Rectangle[] cells = new Rectangle[0];

    public GridView() {
        setStyle("-fx-background-color: linear-gradient(to bottom, #fdfdfd, #e7ebf5);");
        pathLine.setStroke(PATH_STROKE);
        pathLine.setStrokeWidth(PATH_THICKNESS);
        pathLine.setStrokeLineCap(StrokeLineCap.ROUND);
        pathLine.setStrokeLineJoin(StrokeLineJoin.ROUND);
        pathLine.setMouseTransparent(true);
        startMarker.setFill(START_FILL);
        startMarker.setVisible(false);
        startMarker.setMouseTransparent(true);
        content.getChildren().addAll(cellGroup, pathLine, startMarker);
        getChildren().add(content);
        setMinSize(0, 0);
    }

    /**
     * Rebuilds the cells for the provided grid and clears any highlighted path.
     */
    public void update(Grid grid) {
        this.grid = grid;
        cellGroup.getChildren().clear();
        clearPath();
        if (grid == null) {
            cells = new Rectangle[0];
            return;
        }

        cells = new Rectangle[grid.cellCount()];
        for (int row = 0; row < grid.rows(); row++) {
            for (int col = 0; col < grid.cols(); col++) {
                Rectangle cell = new Rectangle(originX(col), originY(row), CELL_SIZE, CELL_SIZE);
                cell.setArcWidth(CORNER_RADIUS);
                cell.setArcHeight(CORNER_RADIUS);
                cell.setFill(CELL_FILL);
                cell.setStroke(CELL_STROKE);
                cells[grid.indexOf(row, col)] = cell;

                Text letter = new Text(String.valueOf(Character.toUpperCase(grid.letterAt(row, col))));
                letter.setFont(Font.font("System", FontWeight.BOLD, CELL_SIZE * 0.45));
                letter.setFill(LETTER_FILL);
                letter.setMouseTransparent(true);
                double textWidth = letter.getLayoutBounds().getWidth();
                double textHeight = letter.getLayoutBounds().getHeight();
                letter.setX(originX(col) + (CELL_SIZE - textWidth) / 2.0);
                letter.setY(originY(row) + (CELL_SIZE + textHeight) / 2.0 - textHeight * 0.2);

                cellGroup.getChildren().addAll(cell, letter);
            }
        }

        double width = grid.cols() * (CELL_SIZE + CELL_GAP) + CELL_GAP;
        double height = grid.rows() * (CELL_SIZE + CELL_GAP) + CELL_GAP;
        setPrefSize(width + CELL_SIZE, height + CELL_SIZE);
        requestLayout();
    }

    /**
     * Highlights the cells of the path and draws a line through their centres in path order.
     */
    public void showPath(WordPath path) {
        clearPath();
        if (grid == null || path == null) {
            return;
        }
        for (Cell cell : path.cells()) {
            if (cell.row() >= grid.rows() || cell.col() >= grid.cols()) {
                return;
            }
        }
        for (Cell cell : path.cells()) {
            cells[grid.indexOf(cell.row(), cell.col())].setFill(PATH_FILL);
            pathLine.getPoints().addAll(centerX(cell.col()), centerY(cell.row()));
        }
        Cell first = path.first();
        startMarker.setCenterX(centerX(first.col()));
        startMarker.setCenterY(centerY(first.row()));
        startMarker.setVisible(true);
    }

    public void clearPath() {
        for (Rectangle cell : cells) {
            cell.setFill(CELL_FILL);
        }
        pathLine.getPoints().clear();
        startMarker.setVisible(false);
    }

    @Override
    protected void layoutChildren() {
        super.layoutChildren();
        var insets = getInsets();
        var bounds = content.getLayoutBounds();
        double availableWidth = getWidth() - insets.getLeft() - insets.getRight();
        double availableHeight = getHeight() - insets.getTop() - insets.getBottom();
        double offsetX = insets.getLeft() + (availableWidth - bounds.getWidth()) / 2.0;
        double offsetY = insets.getTop() + (availableHeight - bounds.getHeight()) / 2.0;
        content.relocate(offsetX, offsetY);
    }

    private static double originX(int col) {
        return CELL_GAP + col * (CELL_SIZE + CELL_GAP);
    }

    private static double originY(int row) {
        return CELL_GAP + row * (CELL_SIZE + CELL_GAP);
    }

    private static double centerX(int col) {
        return originX(col) + CELL_SIZE / 2.0;
    }

    private static double centerY(int row) {
        return originY(row) + CELL_SIZE / 2.0;
    }
}
