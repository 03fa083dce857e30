package radiacool.compute.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import radiacool.compute.api.dto.RadiationRequest;
import radiacool.compute.api.dto.SpectralTextUpload;
import radiacool.compute.service.RadiationService;
import radiacool.config.ApiRoutes;
import radiacool.config.RadiationConfig;
import radiacool.domain.balance.RadiationReport;
import radiacool.domain.balance.TheoreticalHeatingMap;
import radiacool.domain.exception.SpectralDataFormatException;
import radiacool.domain.spectrum.SpectralQuantity;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Slf4j
@RestController
@RequestMapping(ApiRoutes.RADIATION)
@RequiredArgsConstructor
@Tag(name = "Potencia Radiativa", description = "Balance de potencia de enfriamiento y calentamiento radiativo")
public class RadiationController {

    private final RadiationService radiationService;

    @Operation(summary = "Barrido de potencia neta de enfriamiento (temperatura de película x coeficiente)")
    @PostMapping(ApiRoutes.COOLING)
    public ResponseEntity<RadiationReport> cooling(@RequestBody RadiationRequest request) {
        log.info(">>> API: Recibida petición de enfriamiento.");
        return ResponseEntity.ok(radiationService.runCooling(request));
    }

    @Operation(summary = "Barrido de potencia neta de calentamiento")
    @PostMapping(ApiRoutes.HEATING)
    public ResponseEntity<RadiationReport> heating(@RequestBody RadiationRequest request) {
        log.info(">>> API: Recibida petición de calentamiento.");
        return ResponseEntity.ok(radiationService.runHeating(request));
    }

    @Operation(summary = "Enfriamiento a partir de ficheros de texto de dos columnas (λ, valor)")
    @PostMapping(path = ApiRoutes.COOLING_FILES, consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<RadiationReport> coolingFromFiles(
            @RequestPart("reflectance") MultipartFile reflectance,
            @RequestPart("solarSpectrum") MultipartFile solarSpectrum,
            @RequestPart("emissivity") MultipartFile emissivity,
            @RequestPart("transmittance") MultipartFile transmittance,
            @RequestPart(name = "config", required = false) RadiationConfig config
    ) {
        log.info(">>> API: Recibidos ficheros espectrales para enfriamiento.");
        return ResponseEntity.ok(radiationService.runCooling(
                toUpload(reflectance, solarSpectrum, emissivity, transmittance, config)));
    }

    @Operation(summary = "Calentamiento a partir de ficheros de texto de dos columnas (λ, valor)")
    @PostMapping(path = ApiRoutes.HEATING_FILES, consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<RadiationReport> heatingFromFiles(
            @RequestPart("reflectance") MultipartFile reflectance,
            @RequestPart("solarSpectrum") MultipartFile solarSpectrum,
            @RequestPart("emissivity") MultipartFile emissivity,
            @RequestPart("transmittance") MultipartFile transmittance,
            @RequestPart(name = "config", required = false) RadiationConfig config
    ) {
        log.info(">>> API: Recibidos ficheros espectrales para calentamiento.");
        return ResponseEntity.ok(radiationService.runHeating(
                toUpload(reflectance, solarSpectrum, emissivity, transmittance, config)));
    }

    @Operation(summary = "Desglose de términos del balance para un único coeficiente de convección")
    @PostMapping(ApiRoutes.COMPONENTS)
    public ResponseEntity<RadiationReport> components(
            @RequestBody RadiationRequest request,
            @RequestParam(name = "coefficient") double coefficient
    ) {
        log.info(">>> API: Recibida petición de componentes (h = {} W/m²K).", coefficient);
        return ResponseEntity.ok(radiationService.runComponents(request, coefficient));
    }

    @Operation(summary = "Mapa teórico de calentamiento (temperatura ambiente x irradiancia solar)")
    @PostMapping(ApiRoutes.THEORETICAL_HEATING)
    public ResponseEntity<TheoreticalHeatingMap> theoreticalHeating(@RequestBody RadiationRequest request) {
        log.info(">>> API: Recibida petición de mapa teórico de calentamiento.");
        return ResponseEntity.ok(radiationService.theoreticalHeating(request));
    }

    @Operation(summary = "Configuración de referencia usada cuando la petición no trae una")
    @GetMapping(ApiRoutes.REFERENCE_CONFIG)
    public ResponseEntity<RadiationConfig> referenceConfig() {
        return ResponseEntity.ok(radiationService.referenceConfig());
    }

    private static SpectralTextUpload toUpload(MultipartFile reflectance,
                                               MultipartFile solarSpectrum,
                                               MultipartFile emissivity,
                                               MultipartFile transmittance,
                                               RadiationConfig config) {
        return SpectralTextUpload.builder()
                .reflectance(read(reflectance, SpectralQuantity.REFLECTANCE))
                .solarSpectrum(read(solarSpectrum, SpectralQuantity.SOLAR_IRRADIANCE))
                .emissivity(read(emissivity, SpectralQuantity.EMISSIVITY))
                .transmittance(read(transmittance, SpectralQuantity.TRANSMITTANCE))
                .config(config)
                .build();
    }

    private static String read(MultipartFile file, SpectralQuantity quantity) {
        try {
            return new String(file.getBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SpectralDataFormatException(quantity,
                    "No se pudo leer el fichero '" + file.getOriginalFilename() + "'", e);
        }
    }
}
