package com.astrofeather.ui;

import com.astrofeather.model.AppConfig;
import com.astrofeather.model.Angle;
import com.astrofeather.model.FeatherOptions;
import com.astrofeather.model.OverlapResult;
import com.astrofeather.model.PowerSpectrumProfile;
import com.astrofeather.service.ImageSource;
import com.astrofeather.service.OverlapAnalyzer;
import com.astrofeather.service.PowerSpectrumService;
import javafx.application.Platform;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.*;
import javafx.scene.layout.*;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;
import javafx.stage.FileChooser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Locale;

public class DiagnosticsTab {

    private static final Logger LOGGER = LoggerFactory.getLogger(DiagnosticsTab.class);

    private final OverlapAnalyzer overlapAnalyzer = new OverlapAnalyzer();
    private final PowerSpectrumService spectrumService = new PowerSpectrumService();

    private TextField txtHigh, txtLow, txtSas, txtLas, txtFwhm;
    private Label valPixels, valMedian, valMean;
    private TextArea txtReport;
    private Button btnRun;

    public Tab create() {
        Tab tab = new Tab("📊 Diagnóstico");
        BorderPane root = new BorderPane();
        root.setPadding(new Insets(20));

        Label title = new Label("Acuerdo de flujo en el rango de solape");
        title.setFont(Font.font("System", FontWeight.BOLD, 18));

        GridPane grid = new GridPane();
        grid.setHgap(10); grid.setVgap(10);
        grid.setStyle("-fx-border-color: #CCC; -fx-padding: 15; -fx-background-color: #F9F9F9; -fx-background-radius: 5;");

        txtHigh = new TextField(); txtHigh.setPrefWidth(350);
        txtLow = new TextField(); txtLow.setPrefWidth(350);
        Button btnHigh = new Button("📂"); btnHigh.setOnAction(e -> browseFits(txtHigh));
        Button btnLow = new Button("📂"); btnLow.setOnAction(e -> browseFits(txtLow));
        txtSas = new TextField("10 arcsec"); txtSas.setPrefWidth(100);
        txtLas = new TextField("2 arcmin"); txtLas.setPrefWidth(100);
        txtFwhm = new TextField(String.format(Locale.US, "%.1f arcsec", AppConfig.getDefaultFwhmArcsec())); txtFwhm.setPrefWidth(100);

        grid.add(new Label("Alta resolución:"), 0, 0); grid.add(txtHigh, 1, 0); grid.add(btnHigh, 2, 0);
        grid.add(new Label("Baja resolución:"), 0, 1); grid.add(txtLow, 1, 1); grid.add(btnLow, 2, 1);
        grid.add(new Label("SAS:"), 0, 2); grid.add(txtSas, 1, 2);
        grid.add(new Label("LAS:"), 0, 3); grid.add(txtLas, 1, 3);
        grid.add(new Label("FWHM baja res.:"), 0, 4); grid.add(txtFwhm, 1, 4);

        btnRun = new Button("🔬 Analizar");
        btnRun.setStyle("-fx-base: #2196F3; -fx-text-fill: white; -fx-font-weight: bold;");
        btnRun.setOnAction(e -> runDiagnostics());

        GridPane statsGrid = new GridPane();
        statsGrid.setHgap(20); statsGrid.setVgap(15);
        statsGrid.setPadding(new Insets(15));
        statsGrid.setStyle("-fx-border-color: #DDD; -fx-border-radius: 8; -fx-background-color: #FAFAFA;");
        statsGrid.setAlignment(Pos.CENTER);
        valPixels = createStatCard(statsGrid, "Píxeles en banda", 0);
        valMedian = createStatCard(statsGrid, "Mediana alta/baja", 1);
        valMean = createStatCard(statsGrid, "Media alta/baja", 2);

        txtReport = new TextArea();
        txtReport.setEditable(false);
        txtReport.setPrefRowCount(14);
        txtReport.setStyle("-fx-font-family: 'monospaced'; -fx-font-size: 11px;");

        VBox content = new VBox(15, title, grid, btnRun, statsGrid, txtReport);
        content.setAlignment(Pos.TOP_CENTER);
        content.setMaxWidth(800);
        root.setCenter(content);
        tab.setContent(root);
        return tab;
    }

    private Label createStatCard(GridPane grid, String title, int col) {
        Label lblTitle = new Label(title);
        lblTitle.setStyle("-fx-text-fill: #666; -fx-font-size: 10px;");
        Label value = new Label("--");
        value.setFont(Font.font("System", FontWeight.BOLD, 16));
        VBox box = new VBox(5, lblTitle, value);
        box.setAlignment(Pos.CENTER); box.setPrefWidth(140);
        grid.add(box, col, 0);
        return value;
    }

    private void browseFits(TextField tf) {
        FileChooser fc = new FileChooser();
        fc.getExtensionFilters().add(new FileChooser.ExtensionFilter("FITS", "*.fits", "*.fit"));
        File dir = new File(AppConfig.getLastDirectory());
        if (dir.isDirectory()) fc.setInitialDirectory(dir);
        File f = fc.showOpenDialog(tf.getScene().getWindow());
        if (f != null) tf.setText(f.getAbsolutePath());
    }

    private void runDiagnostics() {
        if (txtHigh.getText().isEmpty() || txtLow.getText().isEmpty()) {
            txtReport.setText("⚠️ Selecciona las dos imágenes.");
            return;
        }
        Angle sas, las, fwhm;
        try {
            sas = Angle.parse(txtSas.getText());
            las = Angle.parse(txtLas.getText());
            fwhm = Angle.parse(txtFwhm.getText());
        } catch (IllegalArgumentException e) {
            txtReport.setText("❌ " + e.getMessage());
            return;
        }
        ImageSource hi = ImageSource.of(new File(txtHigh.getText()));
        ImageSource lo = ImageSource.of(new File(txtLow.getText()));
        double minBeam = AppConfig.getMinBeamFraction();

        btnRun.setDisable(true);
        txtReport.setText("Analizando...");

        new Thread(() -> {
            try {
                OverlapResult overlap = overlapAnalyzer.compare(hi, lo, sas, las, fwhm, minBeam);
                PowerSpectrumProfile profile = spectrumService.profile(hi, lo, FeatherOptions.defaults().lowResFwhm(fwhm));

                StringBuilder sb = new StringBuilder();
                sb.append(String.format("🎯 Banda %s - %s | min_beam_fraction=%.2f\n", sas, las, minBeam));
                sb.append(String.format("   Razones finitas: %d de %d\n", overlap.finiteRatios().length, overlap.selected()));
                sb.append("--------------------------------------------------\n");
                sb.append(String.format("%8s %12s %10s %10s %12s %12s\n", "r(px)", "escala(\")", "kfft", "ikfft", "|FT alta|", "|FT baja|"));
                int step = Math.max(1, profile.bins() / 20);
                for (int b = 1; b < profile.bins(); b += step) {
                    sb.append(String.format(Locale.US, "%8.1f %12.2f %10.4f %10.4f %12.4g %12.4g\n",
                            profile.radius[b], profile.angularScaleArcsec[b], profile.kernel[b],
                            profile.inverseKernel[b], profile.highRes[b], profile.lowRes[b]));
                }

                Platform.runLater(() -> {
                    valPixels.setText(String.valueOf(overlap.selected()));
                    valMedian.setText(String.format("%.3f", overlap.medianRatio()));
                    valMean.setText(String.format("%.3f", overlap.meanRatio()));
                    txtReport.setText(sb.toString());
                    btnRun.setDisable(false);
                });
            } catch (Exception e) {
                LOGGER.error("Fallo en el diagnóstico", e);
                Platform.runLater(() -> {
                    txtReport.setText("❌ " + e.getMessage());
                    btnRun.setDisable(false);
                });
            }
        }).start();
    }
}
