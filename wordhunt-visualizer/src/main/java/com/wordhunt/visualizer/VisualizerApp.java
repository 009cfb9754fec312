package com.wordhunt.visualizer;

import com.wordhunt.core.Grid;
import com.wordhunt.core.InvalidGridException;
import com.wordhunt.core.io.GridParser;
import com.wordhunt.core.result.ResultEntry;
import com.wordhunt.core.solver.BacktrackingSolver;
import com.wordhunt.core.solver.SolveConstraints;
import com.wordhunt.core.trie.Trie;
import com.wordhunt.visualizer.model.SolveFrame;
import com.wordhunt.visualizer.task.SolveTask;
import com.wordhunt.visualizer.task.SolveTask.DictionarySource;
import com.wordhunt.visualizer.ui.GridView;
import com.wordhunt.visualizer.ui.StatsPane;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import javafx.application.Application;
import javafx.beans.property.BooleanProperty;
import javafx.beans.property.ObjectProperty;
import javafx.beans.property.ReadOnlyStringWrapper;
import javafx.beans.property.SimpleBooleanProperty;
import javafx.beans.property.SimpleObjectProperty;
import javafx.collections.FXCollections;
import javafx.collections.ObservableList;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.control.Button;
import javafx.scene.control.CheckBox;
import javafx.scene.control.ComboBox;
import javafx.scene.control.Label;
import javafx.scene.control.ProgressBar;
import javafx.scene.control.Spinner;
import javafx.scene.control.SpinnerValueFactory;
import javafx.scene.control.TableColumn;
import javafx.scene.control.TableView;
import javafx.scene.control.TextArea;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.GridPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Priority;
import javafx.scene.layout.Region;
import javafx.scene.layout.VBox;
import javafx.stage.FileChooser;
import javafx.stage.Stage;
import javafx.util.StringConverter;

public final class VisualizerApp extends Application {

    private static final Logger LOGGER = Logger.getLogger(VisualizerApp.class.getName());
    private static final int DEFAULT_SIZE = 4;
    private static final int MAX_SIZE = 12;
    private static final int DEFAULT_TIME_LIMIT_MILLIS = 10_000;
    private static final Path BUILT_IN_DICTIONARY = Paths.get("wordlists", "words.txt");
    private static final String SAMPLE_GRID = "rnsm\ntduo\nrasa\nethh";

    private final ObservableList<ResultEntry> entries = FXCollections.observableArrayList();
    private final ObjectProperty<SolveFrame> currentFrame = new SimpleObjectProperty<>();
    private final BooleanProperty solving = new SimpleBooleanProperty(false);

    private SolveConstraints.SolveMode solveMode = SolveConstraints.SolveMode.SEQ;

    private GridView gridView;
    private StatsPane statsPane;
    private TableView<ResultEntry> resultsTable;
    private TextArea gridInput;
    private TextArea pastedWords;
    private Label dictionaryLabel;
    private Spinner<Integer> sizeSpinner;
    private Spinner<Integer> minLengthSpinner;
    private Spinner<Integer> minScoreSpinner;
    private Spinner<Integer> topSpinner;
    private Spinner<Integer> timeLimitSpinner;
    private CheckBox diagonalCheckBox;
    private CheckBox pathsCheckBox;
    private CheckBox oneBasedCheckBox;
    private ComboBox<SolveConstraints.SolveMode> solveModeComboBox;
    private ProgressBar progressBar;
    private Label statusLabel;

    private Path dictionaryFile;
    private Trie cachedTrie;
    private Object cachedTrieKey;
    private SolveTask solveTask;

    public static void main(String[] args) {
        launch(args);
    }

    @Override
    public void start(Stage stage) {
        configureSolveMode(getParameters().getRaw());
        if (Files.exists(BUILT_IN_DICTIONARY)) {
            dictionaryFile = BUILT_IN_DICTIONARY;
        }

        gridView = new GridView();
        statsPane = new StatsPane();
        resultsTable = buildResultsTable();

        currentFrame.addListener((obs, oldFrame, newFrame) -> {
            gridView.update(newFrame == null ? null : newFrame.grid());
            statsPane.update(newFrame);
            entries.setAll(newFrame == null ? List.of() : newFrame.entries());
        });
        resultsTable.getSelectionModel().selectedItemProperty().addListener((obs, oldEntry, newEntry) -> {
            if (newEntry == null) {
                gridView.clearPath();
                statsPane.showSelectedPath(null);
            } else {
                gridView.showPath(newEntry.path());
                statsPane.showSelectedPath(newEntry.path().format(oneBasedCheckBox.isSelected()));
            }
        });

        VBox right = new VBox(12, statsPane, resultsTable);
        VBox.setVgrow(resultsTable, Priority.ALWAYS);

        BorderPane root = new BorderPane();
        root.setPadding(new Insets(16));
        root.setLeft(buildInputPane());
        BorderPane.setMargin(root.getLeft(), new Insets(0, 16, 0, 0));
        root.setCenter(gridView);
        BorderPane.setAlignment(gridView, Pos.CENTER);
        root.setRight(right);
        BorderPane.setMargin(right, new Insets(0, 0, 0, 16));

        HBox controls = buildControls();
        root.setBottom(controls);
        BorderPane.setMargin(controls, new Insets(16, 0, 0, 0));

        previewGrid();

        Scene scene = new Scene(root, 1280, 800);
        stage.setTitle("Word Hunt Solver");
        stage.setScene(scene);
        stage.setMinWidth(1024);
        stage.setMinHeight(640);
        stage.show();
    }

    private VBox buildInputPane() {
        Label gridCaption = new Label("Grid");
        gridCaption.setStyle("-fx-font-size: 16px; -fx-font-weight: bold;");
        gridInput = new TextArea(SAMPLE_GRID);
        gridInput.setPrefRowCount(6);
        gridInput.setPrefColumnCount(16);
        gridInput.setStyle("-fx-font-family: monospace;");
        gridInput.textProperty().addListener((obs, oldText, newText) -> previewGrid());

        Label dictionaryCaption = new Label("Dictionary");
        dictionaryCaption.setStyle("-fx-font-size: 16px; -fx-font-weight: bold;");
        dictionaryLabel = new Label(dictionaryFile == null ? "No file chosen" : dictionaryFile.toString());
        dictionaryLabel.setWrapText(true);
        Button chooseButton = new Button("Choose file...");
        chooseButton.setOnAction(event -> chooseDictionary());
        Button clearFileButton = new Button("Clear");
        clearFileButton.setOnAction(event -> {
            dictionaryFile = null;
            dictionaryLabel.setText("No file chosen");
        });

        pastedWords = new TextArea();
        pastedWords.setPromptText("...or paste words here, one per line");
        pastedWords.setPrefRowCount(10);
        pastedWords.setPrefColumnCount(16);

        VBox pane = new VBox(8, gridCaption, gridInput, dictionaryCaption, dictionaryLabel,
                new HBox(8, chooseButton, clearFileButton), pastedWords);
        pane.setPrefWidth(240);
        VBox.setVgrow(pastedWords, Priority.ALWAYS);
        chooseButton.disableProperty().bind(solving);
        clearFileButton.disableProperty().bind(solving);
        return pane;
    }

    private TableView<ResultEntry> buildResultsTable() {
        TableView<ResultEntry> table = new TableView<>(entries);
        table.setPlaceholder(new Label("No words found (or dictionary not loaded)."));

        TableColumn<ResultEntry, String> scoreColumn = new TableColumn<>("Score");
        scoreColumn.setCellValueFactory(data -> new ReadOnlyStringWrapper(
                Integer.toString(data.getValue().score())));
        TableColumn<ResultEntry, String> wordColumn = new TableColumn<>("Word");
        wordColumn.setCellValueFactory(data -> new ReadOnlyStringWrapper(data.getValue().word()));
        TableColumn<ResultEntry, String> lengthColumn = new TableColumn<>("Len");
        lengthColumn.setCellValueFactory(data -> new ReadOnlyStringWrapper(
                Integer.toString(data.getValue().length())));
        TableColumn<ResultEntry, String> pathColumn = new TableColumn<>("Path");
        pathColumn.setCellValueFactory(data -> new ReadOnlyStringWrapper(
                data.getValue().path().format(oneBasedCheckBox.isSelected())));
        pathColumn.setPrefWidth(220);

        for (TableColumn<ResultEntry, String> column : List.of(scoreColumn, wordColumn, lengthColumn, pathColumn)) {
            column.setSortable(false);
            table.getColumns().add(column);
        }
        table.setPrefWidth(360);
        return table;
    }

    private HBox buildControls() {
        Button solveButton = new Button("Solve");
        solveButton.setDefaultButton(true);
        solveButton.setOnAction(event -> runSolve());

        Button cancelButton = new Button("Cancel");
        cancelButton.setOnAction(event -> cancelSolve());

        Button clearButton = new Button("Clear");
        clearButton.setOnAction(event -> {
            entries.clear();
            statusLabel.setText("Ready");
            previewGrid();
        });

        sizeSpinner = integerSpinner(1, MAX_SIZE, DEFAULT_SIZE, 1, 70);
        sizeSpinner.valueProperty().addListener((obs, oldValue, newValue) -> previewGrid());
        minLengthSpinner = integerSpinner(1, 16, SolveConstraints.DEFAULT_MIN_LENGTH, 1, 70);
        minScoreSpinner = integerSpinner(0, 11, 0, 1, 70);
        topSpinner = integerSpinner(0, 10_000, 0, 10, 90);
        timeLimitSpinner = integerSpinner(0, 600_000, DEFAULT_TIME_LIMIT_MILLIS, 500, 110);

        diagonalCheckBox = new CheckBox("Diagonals");
        diagonalCheckBox.setSelected(true);
        pathsCheckBox = new CheckBox("Show paths");
        pathsCheckBox.setSelected(true);
        oneBasedCheckBox = new CheckBox("1-based");
        oneBasedCheckBox.setSelected(true);
        oneBasedCheckBox.selectedProperty().addListener((obs, oldValue, newValue) -> resultsTable.refresh());

        solveModeComboBox = new ComboBox<>();
        solveModeComboBox.getItems().setAll(SolveConstraints.SolveMode.values());
        solveModeComboBox.setConverter(new StringConverter<>() {
            @Override
            public String toString(SolveConstraints.SolveMode mode) {
                if (mode == null) {
                    return "";
                }
                return switch (mode) {
                    case SEQ -> "Sequential";
                    case PAR -> "Parallel";
                };
            }

            @Override
            public SolveConstraints.SolveMode fromString(String string) {
                if (string == null) {
                    return null;
                }
                return switch (string.toLowerCase()) {
                    case "sequential" -> SolveConstraints.SolveMode.SEQ;
                    case "parallel" -> SolveConstraints.SolveMode.PAR;
                    default -> null;
                };
            }
        });
        solveModeComboBox.setValue(solveMode);
        solveModeComboBox.valueProperty().addListener((obs, oldValue, newValue) -> {
            if (newValue != null) {
                solveMode = newValue;
            }
        });

        progressBar = new ProgressBar(0);
        progressBar.setPrefWidth(160);
        statusLabel = new Label("Ready");
        statusLabel.setMinWidth(220);

        Region spacer = new Region();
        HBox.setHgrow(spacer, Priority.ALWAYS);

        GridPane options = new GridPane();
        options.setHgap(8);
        options.setVgap(6);
        options.addRow(0, new Label("Size:"), sizeSpinner, new Label("Min length:"), minLengthSpinner,
                new Label("Min score:"), minScoreSpinner, new Label("Top N:"), topSpinner);
        options.addRow(1, new Label("Mode:"), solveModeComboBox, new Label("Time limit (ms):"), timeLimitSpinner,
                diagonalCheckBox, pathsCheckBox, oneBasedCheckBox);

        HBox controls = new HBox(12, solveButton, cancelButton, clearButton, options, spacer, progressBar,
                statusLabel);
        controls.setAlignment(Pos.CENTER_LEFT);

        resultsTable.getColumns().get(3).visibleProperty().bind(pathsCheckBox.selectedProperty());
        solveButton.disableProperty().bind(solving);
        cancelButton.disableProperty().bind(solving.not());
        clearButton.disableProperty().bind(solving);
        sizeSpinner.disableProperty().bind(solving);
        minLengthSpinner.disableProperty().bind(solving);
        minScoreSpinner.disableProperty().bind(solving);
        topSpinner.disableProperty().bind(solving);
        timeLimitSpinner.disableProperty().bind(solving);
        diagonalCheckBox.disableProperty().bind(solving);
        solveModeComboBox.disableProperty().bind(solving);
        return controls;
    }

    private void chooseDictionary() {
        FileChooser chooser = new FileChooser();
        chooser.setTitle("Choose word list");
        chooser.getExtensionFilters().addAll(
                new FileChooser.ExtensionFilter("Text files", "*.txt"),
                new FileChooser.ExtensionFilter("All files", "*.*"));
        File file = chooser.showOpenDialog(gridView.getScene().getWindow());
        if (file != null) {
            dictionaryFile = file.toPath();
            dictionaryLabel.setText(dictionaryFile.toString());
        }
    }

    private void previewGrid() {
        if (solving.get() || gridInput == null || sizeSpinner == null) {
            return;
        }
        try {
            Grid grid = GridParser.parse(gridInput.getText(), sizeSpinner.getValue());
            currentFrame.set(null);
            gridView.update(grid);
        } catch (InvalidGridException ex) {
            gridView.update(null);
        }
    }

    private void runSolve() {
        if (solving.get()) {
            return;
        }
        Grid grid;
        try {
            grid = GridParser.parse(gridInput.getText(), normalizeSpinnerValue(sizeSpinner));
        } catch (InvalidGridException ex) {
            statusLabel.setText("Error: " + ex.getMessage());
            return;
        }

        DictionarySource source = resolveDictionary();
        if (source == null) {
            statusLabel.setText("Error: choose a word list or paste words");
            return;
        }

        int minLength = Math.max(1, normalizeSpinnerValue(minLengthSpinner));
        SolveConstraints constraints = new SolveConstraints(minLength, diagonalCheckBox.isSelected(),
                Duration.ofMillis(Math.max(0, normalizeSpinnerValue(timeLimitSpinner))), solveMode);
        Object trieKey = List.of(source, minLength);
        Trie reusable = trieKey.equals(cachedTrieKey) ? cachedTrie : null;

        solveTask = new SolveTask(new BacktrackingSolver(), grid, source, reusable, constraints,
                normalizeSpinnerValue(minScoreSpinner), normalizeSpinnerValue(topSpinner));
        progressBar.progressProperty().bind(solveTask.progressProperty());
        statusLabel.textProperty().bind(solveTask.messageProperty());
        solving.set(true);

        solveTask.setOnSucceeded(event -> {
            SolveFrame frame = solveTask.getValue();
            cleanupTaskBindings();
            if (frame != null) {
                cachedTrie = frame.trie();
                cachedTrieKey = trieKey;
                currentFrame.set(frame);
                statusLabel.setText(String.format("Found %,d words. Showing %,d.%s", frame.foundCount(),
                        frame.shownCount(), frame.result().timedOut() ? " (time limit reached)" : ""));
            }
            progressBar.setProgress(1.0);
        });

        solveTask.setOnFailed(event -> {
            Throwable error = solveTask.getException();
            cleanupTaskBindings();
            progressBar.setProgress(0);
            statusLabel.setText(error == null ? "Error" : "Error: " + error.getMessage());
            if (error != null) {
                LOGGER.log(Level.SEVERE, "Solve failed", error);
            }
        });

        solveTask.setOnCancelled(event -> {
            cleanupTaskBindings();
            progressBar.setProgress(0);
            statusLabel.setText("Cancelled");
        });

        Thread thread = new Thread(solveTask, "wordhunt-visualizer-solve");
        thread.setDaemon(true);
        thread.start();
    }

    private void cancelSolve() {
        if (solveTask != null) {
            solveTask.cancel(true);
        }
    }

    private DictionarySource resolveDictionary() {
        if (dictionaryFile != null) {
            return DictionarySource.ofFile(dictionaryFile);
        }
        String pasted = pastedWords.getText() == null ? "" : pastedWords.getText().strip();
        if (!pasted.isEmpty()) {
            return DictionarySource.ofText(pasted);
        }
        return null;
    }

    private void cleanupTaskBindings() {
        solving.set(false);
        progressBar.progressProperty().unbind();
        statusLabel.textProperty().unbind();
        solveTask = null;
    }

    private static Spinner<Integer> integerSpinner(int min, int max, int initial, int step, double width) {
        Spinner<Integer> spinner = new Spinner<>();
        spinner.setValueFactory(new SpinnerValueFactory.IntegerSpinnerValueFactory(min, max, initial, step));
        spinner.setEditable(true);
        spinner.setPrefWidth(width);
        return spinner;
    }

    private int normalizeSpinnerValue(Spinner<Integer> spinner) {
        SpinnerValueFactory<Integer> factory = spinner.getValueFactory();
        if (factory != null) {
            try {
                Integer parsed = factory.getConverter().fromString(spinner.getEditor().getText());
                if (parsed != null) {
                    factory.setValue(parsed);
                }
            } catch (NumberFormatException ex) {
                LOGGER.log(Level.FINE, "Keeping previous spinner value", ex);
            }
        }
        Integer value = spinner.getValue();
        return value == null ? 0 : value;
    }

    private void configureSolveMode(List<String> args) {
        if (args == null) {
            return;
        }
        for (String arg : args) {
            if (arg == null) {
                continue;
            }
            String trimmed = arg.trim();
            if (!trimmed.startsWith("--solve-mode=")) {
                continue;
            }
            String value = trimmed.substring("--solve-mode=".length()).trim();
            if (value.isEmpty()) {
                continue;
            }
            try {
                solveMode = SolveConstraints.SolveMode.valueOf(value.toUpperCase());
            } catch (IllegalArgumentException ex) {
                LOGGER.log(Level.WARNING, "Unknown solve mode: " + value, ex);
            }
            break;
        }
    }
}
