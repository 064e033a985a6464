package com.astrofeather.main;

import com.astrofeather.ui.DiagnosticsTab;
import com.astrofeather.ui.FeatherTab;
import com.astrofeather.ui.SettingsTab;
import javafx.application.Application;
import javafx.scene.Scene;
import javafx.scene.control.TabPane;
import javafx.stage.Stage;

public class FeatherSuiteApp extends Application {

    @Override
    public void start(Stage primaryStage) {
        primaryStage.setTitle("🪶 FeatherSuite 1.0");

        TabPane tabPane = new TabPane();
        tabPane.setTabClosingPolicy(TabPane.TabClosingPolicy.UNAVAILABLE);
        // La combinación primero; diagnóstico y ajustes son de apoyo
        tabPane.getTabs().addAll(
                new FeatherTab().create(),
                new DiagnosticsTab().create(),
                new SettingsTab().create());

        Scene scene = new Scene(tabPane, 1024, 850);
        primaryStage.setScene(scene);
        primaryStage.show();
    }

    public static void main(String[] args) {
        launch(args);
    }
}
