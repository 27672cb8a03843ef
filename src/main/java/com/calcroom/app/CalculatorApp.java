package com.calcroom.app;

import com.calcroom.eval.Calculator;
import com.calcroom.model.CalculatorException;
import com.calcroom.parser.Tokenizer;
import javafx.application.Application;
import javafx.concurrent.Task;
import javafx.stage.Stage;

public class CalculatorApp extends Application {

    private static final boolean DEBUG = false;

    private static final double WIDTH = 640;
    private static final double HEIGHT = 480;

    @Override
    public void start(Stage stage) {

        var input = new javafx.scene.control.TextField();
        input.setPromptText("2 * (3 + 4), sin(1.5pi), 3 4 + 2 *, 2x + 1 = 3 ...");
        javafx.scene.layout.HBox.setHgrow(input, javafx.scene.layout.Priority.ALWAYS);

        var evalBtn = new javafx.scene.control.Button("Evaluate");
        evalBtn.setDefaultButton(true);

        var resultLabel = new javafx.scene.control.Label("Enter an expression");

        var topRow = new javafx.scene.layout.HBox(10, input, evalBtn);
        topRow.setPadding(new javafx.geometry.Insets(10));

        var resultRow = new javafx.scene.layout.HBox(10, resultLabel);
        resultRow.setPadding(new javafx.geometry.Insets(0, 10, 10, 10));

        var historyTable = new javafx.scene.control.TableView<HistoryRow>();
        historyTable.setColumnResizePolicy(javafx.scene.control.TableView.CONSTRAINED_RESIZE_POLICY);

        var exprCol = new javafx.scene.control.TableColumn<HistoryRow, String>("Expression");
        exprCol.setCellValueFactory(cell ->
                new javafx.beans.property.ReadOnlyStringWrapper(cell.getValue().expression())
        );

        var resultCol = new javafx.scene.control.TableColumn<HistoryRow, String>("Result");
        resultCol.setCellValueFactory(cell ->
                new javafx.beans.property.ReadOnlyStringWrapper(cell.getValue().result())
        );

        historyTable.getColumns().addAll(exprCol, resultCol);
        historyTable.setPlaceholder(new javafx.scene.control.Label("No calculations yet."));

        // clicking a row puts its expression back into the input
        historyTable.getSelectionModel().selectedItemProperty().addListener((obs, old, row) -> {
            if (row != null) input.setText(row.expression());
        });

        var logArea = new javafx.scene.control.TextArea();
        logArea.setEditable(false);
        logArea.setPrefRowCount(6);
        logArea.appendText("Calculator initialised.\n");

        evalBtn.setOnAction(e -> {
            String text = input.getText();
            if (text == null) return;

            evalBtn.setDisable(true);
            resultLabel.setText("Evaluating...");
            if (DEBUG) {
                logArea.appendText("Tokens: " + describeTokens(text) + "\n");
            }

            Task<String> task = new Task<>() {
                @Override
                protected String call() {
                    return Calculator.processExpression(text);
                }
            };

            task.setOnSucceeded(ev -> {
                String answer = task.getValue();
                resultLabel.setText("= " + answer);
                historyTable.getItems().add(0, new HistoryRow(text, answer));
                logArea.appendText(text + " -> " + answer + "\n");
                evalBtn.setDisable(false);
            });

            task.setOnFailed(ev -> {
                Throwable ex = task.getException();
                String shown = render(ex);
                resultLabel.setText(shown);
                historyTable.getItems().add(0, new HistoryRow(text, shown));
                logArea.appendText(text + " FAILED: " + (ex == null ? "unknown error" : ex.getMessage()) + "\n");
                if (DEBUG && ex != null) {
                    for (StackTraceElement ste : ex.getStackTrace()) {
                        logArea.appendText("  at " + ste + "\n");
                    }
                }
                evalBtn.setDisable(false);
            });

            new Thread(task, "calc-worker").start();
        });

        var clearBtn = new javafx.scene.control.Button("Clear History");
        clearBtn.setOnAction(e -> {
            historyTable.getItems().clear();
            logArea.appendText("History cleared.\n");
        });
        topRow.getChildren().add(clearBtn);

        var top = new javafx.scene.layout.VBox(topRow, resultRow);

        var root = new javafx.scene.layout.BorderPane();
        root.setTop(top);
        root.setCenter(historyTable);
        root.setBottom(logArea);

        var scene = new javafx.scene.Scene(root, WIDTH, HEIGHT);
        stage.setTitle("Calc Room");
        stage.setScene(scene);
        stage.show();
    }

    private record HistoryRow(String expression, String result) {}

    static String render(Throwable ex) {
        if (ex instanceof CalculatorException ce) {
            return "Error: " + ce.error().description();
        }
        return "Error: " + (ex == null ? "unknown" : ex.getClass().getSimpleName());
    }

    private static String describeTokens(String text) {
        try {
            return String.valueOf(new Tokenizer(text).tokenize());
        } catch (CalculatorException ex) {
            return "(" + ex.getMessage() + ")";
        }
    }
}
