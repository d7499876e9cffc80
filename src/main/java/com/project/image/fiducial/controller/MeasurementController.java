package com.project.image.fiducial.controller;

import com.project.image.fiducial.DTOs.MeasurementReport;
import com.project.image.fiducial.DTOs.MeasurementRequest;
import com.project.image.fiducial.detection.CropWindow;
import com.project.image.fiducial.detection.DetectionResult;
import com.project.image.fiducial.detection.DetectionSettings;
import com.project.image.fiducial.detection.FiducialMeasurement;
import com.project.image.fiducial.detection.GrayscaleRaster;
import com.project.image.fiducial.exceptions.DegenerateRefinedCropException;
import com.project.image.fiducial.exceptions.InvalidCropException;
import com.project.image.fiducial.exceptions.InvalidSmoothingWindowException;
import com.project.image.fiducial.exceptions.MeasurementException;
import com.project.image.fiducial.exceptions.NoMarksFoundException;
import com.project.image.fiducial.service.MeasurementService;
import com.project.image.fiducial.service.RasterCodec;
import com.project.image.fiducial.service.StorageService;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

@Controller
@Validated
public class MeasurementController {
    private static final Logger log = LoggerFactory.getLogger(MeasurementController.class);

    // Поддържани формати на изображения
    private static final List<String> SUPPORTED_FORMATS = Arrays.asList(
            "image/tiff", "image/jpeg", "image/jpg", "image/png", "image/bmp"
    );
    private static final long MAX_FILE_SIZE = 50L * 1024 * 1024; // 50MB

    private final MeasurementService measurementService;
    private final StorageService storageService;
    private final RasterCodec rasterCodec;
    private final DetectionSettings detectionSettings;

    @Value("${app.measurement.default-real-width:10.0}")
    private double defaultRealWidth;
    @Value("${app.measurement.default-crop-top:100}")
    private int defaultCropTop;
    @Value("${app.measurement.default-crop-bottom:300}")
    private int defaultCropBottom;
    @Value("${app.measurement.default-crop-left:100}")
    private int defaultCropLeft;
    @Value("${app.measurement.default-crop-right:100}")
    private int defaultCropRight;
    @Value("${app.measurement.default-band-width:2000}")
    private int defaultBandWidth;
    @Value("${app.measurement.unit:microns}")
    private String unit;

    public MeasurementController(MeasurementService measurementService, StorageService storageService,
                                 RasterCodec rasterCodec, DetectionSettings detectionSettings) {
        this.measurementService = measurementService;
        this.storageService = storageService;
        this.rasterCodec = rasterCodec;
        this.detectionSettings = detectionSettings;
    }

    @GetMapping("/measure")
    public String showForm(Model model) {
        populateFormDefaults(model);
        return "measure";
    }

    @PostMapping(value = "/measure", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String handleUpload(
            @RequestParam("file") @NotNull MultipartFile file,
            @RequestParam("realWidth")
            @DecimalMin(value = "0", inclusive = false, message = "Реалната ширина трябва да бъде положително число")
            double realWidth,
            @RequestParam(name = "cropTop", defaultValue = "${app.measurement.default-crop-top:100}") @Min(0) int cropTop,
            @RequestParam(name = "cropBottom", defaultValue = "${app.measurement.default-crop-bottom:300}") @Min(0) int cropBottom,
            @RequestParam(name = "cropLeft", defaultValue = "${app.measurement.default-crop-left:100}") @Min(0) int cropLeft,
            @RequestParam(name = "cropRight", defaultValue = "${app.measurement.default-crop-right:100}") @Min(0) int cropRight,
            @RequestParam(name = "bandWidth", defaultValue = "${app.measurement.default-band-width:2000}")
            @Min(value = 1, message = "Ширината на лентата трябва да бъде поне 1 пиксел")
            int bandWidth,
            @RequestParam(name = "verticalCropExtra", required = false) @Min(0) Integer verticalCropExtra,
            @RequestParam(name = "peakWidthMax", required = false) @Min(1) Integer peakWidthMax,
            @RequestParam(name = "peakDistMax", required = false) @Min(1) Integer peakDistMax,
            Model model
    ) throws IOException {

        // Валидация на файла
        validateUploadedFile(file);

        log.info("Processing file: {} ({}KB), realWidth: {}, crop: {}/{}/{}/{}, band: {}",
                file.getOriginalFilename(), file.getSize() / 1024, realWidth,
                cropTop, cropBottom, cropLeft, cropRight, bandWidth);

        // Запазване на оригиналния файл
        var storedOriginal = storageService.store(file);
        log.debug("File stored as: {}", storedOriginal.filename());

        try {
            // Зареждане на изображението в нива на сивото
            GrayscaleRaster raster = rasterCodec.decode(file.getBytes());

            MeasurementRequest request = new MeasurementRequest(
                    realWidth,
                    new CropWindow(cropTop, cropBottom, cropLeft, cropRight),
                    bandWidth,
                    detectionSettings.withOverrides(verticalCropExtra, peakWidthMax, peakDistMax),
                    false);
            MeasurementReport report = measurementService.measure(raster, request);

            // Запазване на резултатите
            var annotated = storageService.storeResultImage(report.annotatedPng(), "annotated");
            var horizontalPlot = storageService.storeResultImage(report.horizontalPlotPng(), "sample_vert_edge_detect");
            var verticalPlot = storageService.storeResultImage(report.verticalPlotPng(), "sample_mark_detect");

            // Подготовка на модела за шаблона
            model.addAttribute("originalPath", "/" + storedOriginal.relativeWebPath());
            model.addAttribute("annotatedPath", "/" + annotated.relativeWebPath());
            model.addAttribute("horizontalPlotPath", "/" + horizontalPlot.relativeWebPath());
            model.addAttribute("verticalPlotPath", "/" + verticalPlot.relativeWebPath());
            populateResultModel(model, report);

            log.info("Measurement completed successfully for {}", file.getOriginalFilename());
            return "result";

        } catch (MeasurementException e) {
            log.warn("Measurement failed for {}: {}", file.getOriginalFilename(), e.getMessage());
            populateFormDefaults(model);
            model.addAttribute("error", e.getMessage());
            model.addAttribute("suggestion", getSuggestionForError(e));
            return "measure";
        }
    }

    private void validateUploadedFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Моля изберете файл за качване");
        }

        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException(
                    "Неподдържан формат на файла: " + contentType +
                            ". Поддържани формати: " + String.join(", ", SUPPORTED_FORMATS)
            );
        }

        // Проверка за максимален размер (допълнително към Spring конфигурацията)
        if (file.getSize() > MAX_FILE_SIZE) {
            throw new IllegalArgumentException("Файлът е твърде голям. Максимален размер: 50MB");
        }
    }

    private void populateFormDefaults(Model model) {
        model.addAttribute("defaultRealWidth", defaultRealWidth);
        model.addAttribute("defaultCropTop", defaultCropTop);
        model.addAttribute("defaultCropBottom", defaultCropBottom);
        model.addAttribute("defaultCropLeft", defaultCropLeft);
        model.addAttribute("defaultCropRight", defaultCropRight);
        model.addAttribute("defaultBandWidth", defaultBandWidth);
        model.addAttribute("defaultVerticalCropExtra", detectionSettings.verticalCropExtra());
        model.addAttribute("defaultPeakWidthMax", detectionSettings.peakWidthMax());
        model.addAttribute("defaultPeakDistMax", detectionSettings.peakDistMax());
        model.addAttribute("unit", unit);
        model.addAttribute("supportedFormats", String.join(", ", SUPPORTED_FORMATS));
    }

    private void populateResultModel(Model model, MeasurementReport report) {
        FiducialMeasurement measurement = report.measurement();
        DetectionResult horizontal = measurement.horizontal();
        DetectionResult vertical = measurement.vertical();

        model.addAttribute("width", report.width());
        model.addAttribute("height", report.height());
        model.addAttribute("unit", unit);
        model.addAttribute("realWidth", measurement.calibration().realWidth());
        model.addAttribute("pixelsPerUnit", String.format(Locale.ROOT, "%.3f", measurement.calibration().pixelsPerUnit()));

        model.addAttribute("horizontalDistance", String.format(Locale.ROOT, "%.3f", horizontal.distance()));
        model.addAttribute("horizontalMarks", List.of(
                new MarkDetails(1, horizontal.localPeak1(), horizontal.absolutePeak1(), horizontal.spikes().spike1().prominence()),
                new MarkDetails(2, horizontal.localPeak2(), horizontal.absolutePeak2(), horizontal.spikes().spike2().prominence())));
        model.addAttribute("verticalDistance", String.format(Locale.ROOT, "%.3f", vertical.distance()));
        model.addAttribute("verticalMarks", List.of(
                new MarkDetails(1, vertical.localPeak1(), vertical.absolutePeak1(), vertical.spikes().spike1().prominence()),
                new MarkDetails(2, vertical.localPeak2(), vertical.absolutePeak2(), vertical.spikes().spike2().prominence())));
        model.addAttribute("refinedCrop", measurement.refinedCrop());
    }

    private String getSuggestionForError(MeasurementException e) {
        if (e instanceof NoMarksFoundException) {
            return "Проверете изрязването: маркерите трябва да са близо до краищата на изрязаната област. "
                    + "Опитайте с по-голяма максимална ширина или разстояние на пика.";
        } else if (e instanceof DegenerateRefinedCropException) {
            return "Хоризонталните маркери са твърде близо един до друг. Намалете допълнителното вертикално изрязване.";
        } else if (e instanceof InvalidCropException) {
            return "Изрязването премахва цялото изображение. Намалете отстъпите.";
        } else if (e instanceof InvalidSmoothingWindowException) {
            return "Изрязаната област е твърде малка за изглаждането. Намалете изрязването.";
        }
        return "Опитайте с различни параметри или друго изображение.";
    }

    // Помощен клас за детайлите на маркерите
    public static record MarkDetails(int id, int localPosition, int absolutePosition, double prominence) {}
}
