package com.astrofeather.ui;

import com.astrofeather.model.AppConfig;
import com.astrofeather.model.Angle;
import com.astrofeather.model.CubeFeatherResult;
import com.astrofeather.model.FeatherOptions;
import com.astrofeather.model.FeatherResult;
import com.astrofeather.model.MergeOptions;
import com.astrofeather.service.CubeFeatherService;
import com.astrofeather.service.FeatherKernelBuilder;
import com.astrofeather.service.FitsIoService;
import com.astrofeather.service.FourierMerger;
import com.astrofeather.service.ImageSource;
import com.astrofeather.service.PlaneFeatherService;
import com.astrofeather.service.Regridder;
import com.astrofeather.service.WcsReprojector;
import javafx.application.Platform;
import javafx.concurrent.Task;
import javafx.geometry.Insets;
import javafx.scene.control.*;
import javafx.scene.layout.*;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;
import javafx.stage.FileChooser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Locale;

public class FeatherTab {

    private static final Logger LOGGER = LoggerFactory.getLogger(FeatherTab.class);

    private final FitsIoService fitsIo = new FitsIoService();

    private Task<Void> currentTask;

    // UI Controls
    private TextField txtHigh, txtLow, txtOut;
    private TextField txtFwhm, txtHighScale, txtLowScale, txtThreshold;
    private CheckBox chkBmaj, chkKeepRegrid;
    private RadioButton rbPlane, rbCube;
    private RadioButton rbDefault, rbHighpass, rbDeconv, rbReplace;
    private TextArea logArea;
    private ProgressBar progressBar;
    private Button btnStart, btnStop;

    public Tab create() {
        Tab tab = new Tab("🪶 Feather");
        BorderPane root = new BorderPane();
        root.setPadding(new Insets(15));

        Label title = new Label("Combinación Alta + Baja Resolución");
        title.setFont(Font.font("System", FontWeight.BOLD, 18));

        // --- 1. FICHEROS ---
        GridPane filesGrid = new GridPane();
        filesGrid.setHgap(10); filesGrid.setVgap(10);
        filesGrid.setStyle("-fx-border-color: #DDD; -fx-padding: 10; -fx-background-radius: 5; -fx-border-radius: 5;");

        txtHigh = new TextField(); txtHigh.setPromptText("Interferómetro (alta resolución)"); txtHigh.setPrefWidth(380);
        txtLow = new TextField(); txtLow.setPromptText("Antena única (baja resolución)"); txtLow.setPrefWidth(380);
        txtOut = new TextField(); txtOut.setPromptText("Fichero de salida"); txtOut.setPrefWidth(380);
        Button btnHigh = new Button("📂"); btnHigh.setOnAction(e -> browseFits(txtHigh, false));
        Button btnLow = new Button("📂"); btnLow.setOnAction(e -> browseFits(txtLow, false));
        Button btnOut = new Button("💾"); btnOut.setOnAction(e -> browseFits(txtOut, true));

        filesGrid.add(new Label("Alta resolución:"), 0, 0); filesGrid.add(txtHigh, 1, 0); filesGrid.add(btnHigh, 2, 0);
        filesGrid.add(new Label("Baja resolución:"), 0, 1); filesGrid.add(txtLow, 1, 1); filesGrid.add(btnLow, 2, 1);
        filesGrid.add(new Label("Salida:"), 0, 2); filesGrid.add(txtOut, 1, 2); filesGrid.add(btnOut, 2, 2);

        // --- 2. PARÁMETROS ---
        VBox paramsBox = new VBox(8);
        paramsBox.setStyle("-fx-border-color: #2196F3; -fx-border-width: 1; -fx-padding: 10; -fx-background-radius: 5; -fx-background-color: #E3F2FD;");
        Label lblParams = new Label("📐 Parámetros");
        lblParams.setStyle("-fx-font-weight: bold;");

        ToggleGroup tgMode = new ToggleGroup();
        rbPlane = new RadioButton("Imagen 2-D"); rbPlane.setToggleGroup(tgMode); rbPlane.setSelected(true);
        rbCube = new RadioButton("Cubo espectral"); rbCube.setToggleGroup(tgMode);

        GridPane paramGrid = new GridPane();
        paramGrid.setHgap(10); paramGrid.setVgap(5);
        txtFwhm = new TextField(String.format(Locale.US, "%.1f", AppConfig.getDefaultFwhmArcsec())); txtFwhm.setPrefWidth(70);
        chkBmaj = new CheckBox("Usar BMAJ de la cabecera");
        chkBmaj.setOnAction(e -> txtFwhm.setDisable(chkBmaj.isSelected()));
        txtHighScale = new TextField("1.0"); txtHighScale.setPrefWidth(70);
        txtLowScale = new TextField("1.0"); txtLowScale.setPrefWidth(70);
        paramGrid.add(new Label("FWHM baja res. (arcsec):"), 0, 0); paramGrid.add(new HBox(10, txtFwhm, chkBmaj), 1, 0);
        paramGrid.add(new Label("Factor alta res.:"), 0, 1); paramGrid.add(txtHighScale, 1, 1);
        paramGrid.add(new Label("Factor baja res.:"), 0, 2); paramGrid.add(txtLowScale, 1, 2);

        ToggleGroup tgPolicy = new ToggleGroup();
        rbDefault = new RadioButton("Estándar"); rbDefault.setToggleGroup(tgPolicy); rbDefault.setSelected(true);
        rbHighpass = new RadioButton("Filtrar SD con su haz"); rbHighpass.setToggleGroup(tgPolicy);
        rbDeconv = new RadioButton("Deconvolucionar SD"); rbDeconv.setToggleGroup(tgPolicy);
        rbReplace = new RadioButton("Reemplazar por alta res. si 1-kfft >"); rbReplace.setToggleGroup(tgPolicy);
        txtThreshold = new TextField("0.5"); txtThreshold.setPrefWidth(50);
        txtThreshold.disableProperty().bind(rbReplace.selectedProperty().not());

        chkKeepRegrid = new CheckBox("Guardar también la baja resolución remuestreada");
        chkKeepRegrid.setSelected(AppConfig.getWriteRegridded());

        paramsBox.getChildren().addAll(lblParams, new HBox(20, rbPlane, rbCube), paramGrid, new Separator(),
                new HBox(15, rbDefault, rbHighpass, rbDeconv), new HBox(10, rbReplace, txtThreshold), chkKeepRegrid);

        VBox topContainer = new VBox(10, title, filesGrid, paramsBox);

        logArea = new TextArea();
        logArea.setEditable(false);
        logArea.setStyle("-fx-font-family: 'monospaced'; -fx-font-size: 11px;");

        btnStart = new Button("🚀 COMBINAR");
        btnStart.setStyle("-fx-base: #4CAF50; -fx-text-fill: white; -fx-font-weight: bold; -fx-font-size: 14px;");
        btnStart.setMaxWidth(Double.MAX_VALUE);
        btnStop = new Button("🛑 DETENER");
        btnStop.setStyle("-fx-base: #F44336; -fx-text-fill: white; -fx-font-weight: bold;");
        btnStop.setDisable(true);
        progressBar = new ProgressBar(0);
        progressBar.setMaxWidth(Double.MAX_VALUE);
        HBox.setHgrow(btnStart, Priority.ALWAYS);

        btnStart.setOnAction(e -> startFeather());
        btnStop.setOnAction(e -> stopFeather());

        root.setTop(topContainer);
        root.setCenter(logArea);
        BorderPane.setMargin(logArea, new Insets(10, 0, 10, 0));
        root.setBottom(new VBox(5, new HBox(10, btnStart, btnStop), progressBar));
        tab.setContent(root);
        return tab;
    }

    private void browseFits(TextField tf, boolean save) {
        FileChooser fc = new FileChooser();
        fc.getExtensionFilters().add(new FileChooser.ExtensionFilter("FITS", "*.fits", "*.fit"));
        File dir = new File(AppConfig.getLastDirectory());
        if (dir.isDirectory()) fc.setInitialDirectory(dir);
        File f = save ? fc.showSaveDialog(tf.getScene().getWindow()) : fc.showOpenDialog(tf.getScene().getWindow());
        if (f != null) {
            tf.setText(f.getAbsolutePath());
            AppConfig.setLastDirectory(f.getParent());
        }
    }

    private FeatherOptions readOptions() {
        FeatherOptions opts = FeatherOptions.fromConfig()
                .highResScale(Double.parseDouble(txtHighScale.getText().trim()))
                .lowResScale(Double.parseDouble(txtLowScale.getText().trim()))
                .keepRegridded(chkKeepRegrid.isSelected())
                .lowResFwhm(chkBmaj.isSelected() ? null : Angle.arcsec(Double.parseDouble(txtFwhm.getText().trim())));

        MergeOptions merge = MergeOptions.defaults().withMinBeamFraction(AppConfig.getMinBeamFraction());
        if (rbReplace.isSelected()) merge = merge.withReplaceHires(Double.parseDouble(txtThreshold.getText().trim()));
        else if (rbHighpass.isSelected()) merge = merge.withHighpassFilterSD(true);
        else if (rbDeconv.isSelected()) merge = merge.withDeconvSD(true);
        return opts.merge(merge);
    }

    private void startFeather() {
        if (txtHigh.getText().isEmpty() || txtLow.getText().isEmpty() || txtOut.getText().isEmpty()) {
            logArea.appendText("⚠️ Selecciona los dos ficheros de entrada y el de salida.\n");
            return;
        }
        FeatherOptions opts;
        try {
            opts = readOptions();
        } catch (NumberFormatException e) {
            logArea.appendText("❌ Error en números: " + e.getMessage() + "\n");
            return;
        }

        File hiFile = new File(txtHigh.getText());
        File loFile = new File(txtLow.getText());
        File outFile = new File(txtOut.getText());
        boolean cube = rbCube.isSelected();

        btnStart.setDisable(true);
        btnStop.setDisable(false);
        logArea.appendText(String.format("🪶 %s + %s -> %s [%s, %s]\n", hiFile.getName(), loFile.getName(),
                outFile.getName(), cube ? "cubo" : "2-D", opts.merge().policy()));

        WcsReprojector reprojector = new WcsReprojector(WcsReprojector.Interpolation.valueOf(AppConfig.getInterpolation()));
        PlaneFeatherService planeService = new PlaneFeatherService(new Regridder(reprojector), new FeatherKernelBuilder(), new FourierMerger());
        CubeFeatherService cubeService = new CubeFeatherService(reprojector, new FeatherKernelBuilder(), new FourierMerger());

        currentTask = new Task<>() {
            @Override protected Void call() throws Exception {
                ImageSource hi = ImageSource.of(hiFile);
                ImageSource lo = ImageSource.of(loFile);
                if (cube) {
                    CubeFeatherResult res = cubeService.feather(hi, lo, opts, (done, total) -> {
                        updateProgress(done, total);
                        updateMessage(String.format("Plano %d/%d", done, total));
                    });
                    fitsIo.write(outFile, res.toImage());
                    if (res.regriddedLowRes().isPresent()) fitsIo.write(regriddedName(outFile), res.regriddedLowRes().get());
                } else {
                    updateProgress(-1, 1);
                    FeatherResult res = planeService.feather(hi, lo, opts);
                    fitsIo.write(outFile, res.realImage());
                    if (res.regriddedLowRes().isPresent()) fitsIo.write(regriddedName(outFile), res.regriddedLowRes().get());
                    double imag = res.combined().maxAbsImaginary();
                    Platform.runLater(() -> logArea.appendText(String.format("   Residuo imaginario máx: %.3e\n", imag)));
                }
                updateProgress(1, 1);
                return null;
            }
        };

        progressBar.progressProperty().bind(currentTask.progressProperty());
        currentTask.messageProperty().addListener((obs, old, msg) -> progressBar.setTooltip(new Tooltip(msg)));
        currentTask.setOnSucceeded(e -> {
            logArea.appendText("✅ Escrito " + outFile.getAbsolutePath() + "\n");
            finish();
        });
        currentTask.setOnCancelled(e -> {
            logArea.appendText("🛑 Combinación detenida.\n");
            finish();
        });
        currentTask.setOnFailed(e -> {
            Throwable ex = currentTask.getException();
            LOGGER.error("Fallo en la combinación", ex);
            logArea.appendText("❌ " + ex.getMessage() + "\n");
            finish();
        });
        new Thread(currentTask, "feather-task").start();
    }

    private void stopFeather() {
        btnStop.setDisable(true);
        if (currentTask != null) currentTask.cancel();
    }

    private void finish() {
        progressBar.progressProperty().unbind();
        btnStart.setDisable(false);
        btnStop.setDisable(true);
    }

    static File regriddedName(File out) {
        String name = out.getName();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : ".fits";
        return new File(out.getParentFile(), base + "_lowres_regrid" + ext);
    }
}
