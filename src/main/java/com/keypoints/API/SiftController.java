package com.keypoints.API;

import com.keypoints.SIFT.PipelineState;
import com.keypoints.SIFT.RefinedKeypoint;
import com.keypoints.SIFT.RefinementState;
import com.keypoints.SIFT.ScaleExtrema;
import com.keypoints.SIFT.SiftParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/sift")
@CrossOrigin(origins = "*")
public class SiftController {

    @Autowired
    private SiftService siftService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> detectKeypoints(
            @RequestParam(value = "image", required = false) MultipartFile image,
            @RequestParam(value = "octaves", required = false) Integer octaves,
            @RequestParam(value = "scales", required = false) Integer scales,
            @RequestParam(value = "chunkSize", required = false) Integer chunkSize) {
        try {
            if (image == null || image.isEmpty()) {
                return error(ResponseEntity.badRequest(), "Please choose an image.");
            }
            if (!siftService.isValidImageFile(image)) {
                log.warn("Rejected upload {} ({})", image.getOriginalFilename(), image.getContentType());
                return error(ResponseEntity.badRequest(), "Invalid file: " + image.getOriginalFilename());
            }

            SiftParameters parameters = siftService.resolveParameters(octaves, scales, chunkSize);
            PipelineState state = siftService.detect(image, parameters);
            return ResponseEntity.ok().body(toResponse(state));

        } catch (IllegalArgumentException e) {
            log.warn("Bad SIFT request: {}", e.getMessage());
            return error(ResponseEntity.badRequest(), e.getMessage());
        } catch (Exception e) {
            log.error("SIFT request failed", e);
            return error(ResponseEntity.internalServerError(), "Error: " + e.getMessage());
        }
    }

    @GetMapping("/parameters")
    public ResponseEntity<?> defaultParameters() {
        SiftParameters p = siftService.getDefaultParameters();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("numberOfOctaves", p.getNumberOfOctaves());
        body.put("scalesPerOctave", p.getScalesPerOctave());
        body.put("minBlurLevel", p.getMinBlurLevel());
        body.put("assumedBlur", p.getAssumedBlur());
        body.put("chunkSize", p.getChunkSize());
        body.put("dogChunkSize", p.getDogChunkSize());
        body.put("minInterpixelDistance", p.getMinInterpixelDistance());
        body.put("contrastThresholdBase", p.getContrastThresholdBase());
        body.put("edgeThreshold", p.getEdgeThreshold());
        body.put("maxOffset", p.getMaxOffset());
        body.put("maxIterations", p.getMaxIterations());
        return ResponseEntity.ok().body(body);
    }

    private static Map<String, Object> toResponse(PipelineState state) {
        List<Map<String, Object>> keypoints = new ArrayList<>();
        for (RefinedKeypoint kp : state.getKeypoints()) {
            Map<String, Object> k = new LinkedHashMap<>();
            k.put("x", kp.getAbsoluteX());
            k.put("y", kp.getAbsoluteY());
            k.put("sigma", kp.getAbsoluteSigma());
            k.put("value", kp.getInterpolatedValue());
            k.put("octave", kp.getOctave());
            k.put("scaleLevel", kp.getScaleLevel());
            keypoints.add(k);
        }

        Map<String, Integer> rejections = new LinkedHashMap<>();
        for (RefinementState s : RefinementState.values()) {
            if (s != RefinementState.CONVERGED) {
                rejections.put(s.name(), state.requireReport().count(s));
            }
        }

        List<Map<String, Object>> perScale = new ArrayList<>();
        for (ScaleExtrema e : state.requireExtrema()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("octave", e.getOctave());
            entry.put("scaleLevel", e.getScaleLevel());
            entry.put("candidates", e.getCandidates().size());
            entry.put("lowContrast", e.getRejected().size());
            perScale.add(entry);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("width", state.getInputImage().columns());
        response.put("height", state.getInputImage().rows());
        response.put("keypointCount", keypoints.size());
        response.put("keypoints", keypoints);
        response.put("rejections", rejections);
        response.put("candidatesPerScale", perScale);
        return response;
    }

    private static ResponseEntity<?> error(ResponseEntity.BodyBuilder builder, String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        return builder.body(error);
    }
}
