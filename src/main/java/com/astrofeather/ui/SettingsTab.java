package com.astrofeather.ui;

import com.astrofeather.model.AppConfig;
import com.astrofeather.service.WcsReprojector;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.*;
import javafx.scene.layout.*;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;

public class SettingsTab {

    private TextField txtMinBeam, txtFwhm, txtThreads;
    private ComboBox<WcsReprojector.Interpolation> cmbInterp;
    private CheckBox chkWriteRegrid;
    private Label lblResults;

    public Tab create() {
        Tab tab = new Tab("⚙️ Configuración");
        BorderPane root = new BorderPane();
        root.setPadding(new Insets(20));

        VBox content = new VBox(20);
        content.setAlignment(Pos.TOP_CENTER);
        content.setMaxWidth(600);

        Label title = new Label("🔭 Valores por Defecto");
        title.setFont(Font.font("System", FontWeight.BOLD, 20));

        GridPane grid = new GridPane();
        grid.setHgap(15); grid.setVgap(15);
        grid.setStyle("-fx-border-color: #CCC; -fx-padding: 15; -fx-background-color: #F9F9F9; -fx-background-radius: 5;");

        txtMinBeam = new TextField(String.valueOf(AppConfig.getMinBeamFraction()));
        txtFwhm = new TextField(String.valueOf(AppConfig.getDefaultFwhmArcsec()));
        txtThreads = new TextField(String.valueOf(AppConfig.getWorkerThreads()));
        cmbInterp = new ComboBox<>();
        cmbInterp.getItems().addAll(WcsReprojector.Interpolation.values());
        cmbInterp.setValue(WcsReprojector.Interpolation.valueOf(AppConfig.getInterpolation()));
        chkWriteRegrid = new CheckBox("Guardar la baja resolución remuestreada");
        chkWriteRegrid.setSelected(AppConfig.getWriteRegridded());

        grid.add(new Label("Fracción mínima del haz:"), 0, 0); grid.add(txtMinBeam, 1, 0);
        grid.add(new Label("FWHM baja res. (arcsec):"), 0, 1); grid.add(txtFwhm, 1, 1);
        grid.add(new Label("Hilos para cubos:"), 0, 2); grid.add(txtThreads, 1, 2);
        grid.add(new Label("Interpolación:"), 0, 3); grid.add(cmbInterp, 1, 3);
        grid.add(chkWriteRegrid, 0, 4, 2, 1);

        lblResults = new Label("");
        lblResults.setStyle("-fx-font-weight: bold; -fx-text-fill: #2E7D32;");

        Button btnSave = new Button("💾 Guardar TODO");
        btnSave.setStyle("-fx-base: #4CAF50; -fx-text-fill: white; -fx-font-weight: bold; -fx-font-size: 14px;");
        btnSave.setMaxWidth(Double.MAX_VALUE);
        btnSave.setOnAction(e -> saveAllConfig());

        content.getChildren().addAll(title, grid, btnSave, lblResults);
        root.setCenter(content);
        tab.setContent(root);
        return tab;
    }

    private void saveAllConfig() {
        try {
            double minBeam = Double.parseDouble(txtMinBeam.getText().trim());
            double fwhm = Double.parseDouble(txtFwhm.getText().trim());
            int threads = Integer.parseInt(txtThreads.getText().trim());
            if (minBeam <= 0 || minBeam >= 1 || fwhm <= 0) {
                lblResults.setText("❌ Valores fuera de rango");
                return;
            }
            AppConfig.setMinBeamFraction(minBeam);
            AppConfig.setDefaultFwhmArcsec(fwhm);
            AppConfig.setWorkerThreads(threads);
            AppConfig.setInterpolation(cmbInterp.getValue().name());
            AppConfig.setWriteRegridded(chkWriteRegrid.isSelected());
            lblResults.setText(String.format("✅ Configuración Guardada (%d hilos, %s)", AppConfig.getWorkerThreads(), cmbInterp.getValue()));
        } catch (NumberFormatException e) {
            lblResults.setText("❌ Error en números");
        }
    }
}
