package com.gridfolio.engine.service.simulation;

import com.gridfolio.engine.config.SimulationProperties;
import com.gridfolio.engine.exception.InvalidConfigurationException;
import com.gridfolio.engine.exception.PortfolioEngineException;
import com.gridfolio.engine.model.AssetProfile;
import com.gridfolio.engine.model.AssetType;
import com.gridfolio.engine.model.Realization;
import com.gridfolio.engine.model.ScenarioRequest;
import com.gridfolio.engine.model.ScenarioSet;
import com.gridfolio.engine.model.TimeSeries;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Monte Carlo ensemble of correlated hourly generation, price, load and temperature.
 * Weather drivers share a Gaussian copula with AR(1) persistence in latent space.
 */
@Slf4j
@Service
public class ScenarioSimulator {

    private static final double UNIFORM_CLAMP = 1e-12;

    private final SimulationProperties properties;
    private final CorrelationService correlationService;
    private final WindGenerationModel windModel;
    private final SolarGenerationModel solarModel;
    private final PriceSimulator priceSimulator;
    private final LoadSimulator loadSimulator;
    private final AmbientTemperatureModel temperatureModel;
    private final Executor executor;
    private final NormalDistribution standardNormal = new NormalDistribution(null, 0.0, 1.0);

    public ScenarioSimulator(SimulationProperties properties,
                             CorrelationService correlationService,
                             WindGenerationModel windModel,
                             SolarGenerationModel solarModel,
                             PriceSimulator priceSimulator,
                             LoadSimulator loadSimulator,
                             AmbientTemperatureModel temperatureModel,
                             @Qualifier("scenarioExecutor") Executor executor) {
        this.properties = properties;
        this.correlationService = correlationService;
        this.windModel = windModel;
        this.solarModel = solarModel;
        this.priceSimulator = priceSimulator;
        this.loadSimulator = loadSimulator;
        this.temperatureModel = temperatureModel;
        this.executor = executor;
    }

    public ScenarioRequest defaultRequest() {
        return new ScenarioRequest(
                properties.assetProfiles(),
                properties.startTime(),
                properties.getHorizonHours(),
                properties.getEnsembleSize(),
                properties.getSeed(),
                properties.correlationMatrixOrNull());
    }

    public ScenarioSet simulate() {
        return simulate(defaultRequest());
    }

    public ScenarioSet simulate(ScenarioRequest request) {
        validate(request);
        double[][] target = correlationService.targetMatrix(request.assets(), request.correlation());
        RealMatrix factor = correlationService.factor(target);
        log.info("Simulating {} realizations of {} hours for {} assets (seed {})",
                request.ensembleSize(), request.horizonHours(), request.assets().size(), request.seed());

        int size = request.ensembleSize();
        int window = properties.getMaxInFlight();
        List<CompletableFuture<Realization>> futures = new ArrayList<>(size);
        Realization[] realizations = new Realization[size];
        try {
            for (int i = 0; i < size; i++) {
                if (i >= window) {
                    realizations[i - window] = await(futures.get(i - window), i - window);
                }
                int index = i;
                futures.add(CompletableFuture.supplyAsync(() -> simulateRealization(request, factor, index), executor));
            }
            for (int i = Math.max(0, size - window); i < size; i++) {
                realizations[i] = await(futures.get(i), i);
            }
        } catch (RejectedExecutionException e) {
            futures.forEach(future -> future.cancel(false));
            throw new PortfolioEngineException("Scenario executor rejected realization " + futures.size()
                    + " of " + size + "; lower simulation.max-in-flight", e);
        } catch (PortfolioEngineException e) {
            futures.forEach(future -> future.cancel(false));
            throw e;
        }
        return new ScenarioSet(request.assets(), request.start(), request.horizonHours(), request.seed(), List.of(realizations));
    }

    private static Realization await(CompletableFuture<Realization> future, int index) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof PortfolioEngineException engineException) {
                throw engineException;
            }
            throw new PortfolioEngineException("Realization " + index + " failed", e.getCause());
        }
    }

    Realization simulateRealization(ScenarioRequest request, RealMatrix factor, int index) {
        List<AssetProfile> assets = request.assets();
        int n = assets.size();
        int hours = request.horizonHours();
        LocalDateTime start = request.start();
        long seed = request.seed();

        RandomGenerator parametric = RandomStreams.generator(seed, index, RandomStreams.PARAMETRIC);
        double[] resourceFactors = new double[n];
        for (int a = 0; a < n; a++) {
            resourceFactors[a] = lognormalFactor(assets.get(a).getResourceSigma(), parametric.nextGaussian());
        }
        double priceLevel = lognormalFactor(properties.getPrice().getLevelSigma(), parametric.nextGaussian());

        TimeSeries temperature = temperatureModel.simulate(start, hours,
                RandomStreams.generator(seed, index, RandomStreams.TEMPERATURE));
        TimeSeries price = priceSimulator.simulate(start, hours,
                RandomStreams.generator(seed, index, RandomStreams.PRICE), priceLevel);
        TimeSeries load = loadSimulator.simulate(start, hours,
                RandomStreams.generator(seed, index, RandomStreams.LOAD));

        double[][] latent = latentDrivers(factor, n, hours, RandomStreams.generator(seed, index, RandomStreams.WEATHER));

        Map<String, TimeSeries> generation = new LinkedHashMap<>();
        Map<String, TimeSeries> drivers = new LinkedHashMap<>();
        for (int a = 0; a < n; a++) {
            AssetProfile profile = assets.get(a);
            double[] output = new double[hours];
            double[] driver = new double[hours];
            if (profile.getType() == AssetType.WIND) {
                for (int t = 0; t < hours; t++) {
                    LocalDateTime timestamp = start.plusHours(t);
                    double scale = windModel.scaleAt(profile, timestamp, resourceFactors[a]);
                    double speed = windModel.speed(uniform(latent[a][t]), profile.getWeibullShape(), scale);
                    driver[t] = speed;
                    output[t] = windModel.power(profile, speed);
                }
            } else {
                BetaDistribution cloud = new BetaDistribution(null, profile.getCloudAlpha(), profile.getCloudBeta());
                for (int t = 0; t < hours; t++) {
                    LocalDateTime timestamp = start.plusHours(t);
                    double cover = cloud.inverseCumulativeProbability(uniform(latent[a][t]));
                    double irradiance = solarModel.clearSkyIrradiance(profile, timestamp, resourceFactors[a]);
                    driver[t] = cover;
                    output[t] = solarModel.power(profile, irradiance, cover, temperature.get(t));
                }
            }
            generation.put(profile.getName(), new TimeSeries(start, output));
            drivers.put(profile.getName(), new TimeSeries(start, driver));
        }
        if (log.isDebugEnabled()) {
            log.debug("Realization {} done (price level {}, resource factors {})", index, priceLevel, Arrays.toString(resourceFactors));
        }
        return new Realization(index, generation, price, load, temperature, drivers);
    }

    /**
     * Correlated standard normals with AR(1) persistence; {@code z_t = phi z_(t-1) + sqrt(1 - phi^2) e_t}
     * keeps unit variance and the target cross-correlation at every step.
     */
    private double[][] latentDrivers(RealMatrix factor, int n, int hours, RandomGenerator random) {
        double phi = properties.getWeatherPersistence();
        double innovationScale = Math.sqrt(1.0 - phi * phi);
        double[][] latent = new double[n][hours];
        double[] shocks = new double[n];
        for (int t = 0; t < hours; t++) {
            for (int k = 0; k < n; k++) {
                shocks[k] = random.nextGaussian();
            }
            for (int a = 0; a < n; a++) {
                double correlated = 0.0;
                for (int k = 0; k < n; k++) {
                    correlated += factor.getEntry(a, k) * shocks[k];
                }
                latent[a][t] = t == 0 ? correlated : phi * latent[a][t - 1] + innovationScale * correlated;
            }
        }
        return latent;
    }

    private double uniform(double z) {
        double u = standardNormal.cumulativeProbability(z);
        return Math.min(1.0 - UNIFORM_CLAMP, Math.max(UNIFORM_CLAMP, u));
    }

    private static double lognormalFactor(double sigma, double shock) {
        return Math.exp(sigma * shock - 0.5 * sigma * sigma);
    }

    private void validate(ScenarioRequest request) {
        if (request.assets().isEmpty()) {
            throw new InvalidConfigurationException("At least one asset is required");
        }
        if (request.start() == null) {
            throw new InvalidConfigurationException("Simulation start is required");
        }
        if (request.horizonHours() <= 0) {
            throw new InvalidConfigurationException("Horizon must be positive but was " + request.horizonHours());
        }
        if (request.ensembleSize() <= 0) {
            throw new InvalidConfigurationException("Ensemble size must be positive but was " + request.ensembleSize());
        }
        double phi = properties.getWeatherPersistence();
        if (phi < 0.0 || phi >= 1.0) {
            throw new InvalidConfigurationException("Weather persistence must be in [0, 1) but was " + phi);
        }
        Set<String> names = new HashSet<>();
        for (AssetProfile profile : request.assets()) {
            validate(profile);
            if (!names.add(profile.getName())) {
                throw new InvalidConfigurationException("Duplicate asset name " + profile.getName());
            }
        }
    }

    private void validate(AssetProfile profile) {
        String name = profile.getName();
        if (name == null || name.isBlank()) {
            throw new InvalidConfigurationException("Asset name is required");
        }
        if (profile.getType() == null) {
            throw new InvalidConfigurationException("Asset " + name + " has no type");
        }
        if (!(profile.getCapacityMw() > 0.0)) {
            throw new InvalidConfigurationException("Asset " + name + " capacity must be positive but was " + profile.getCapacityMw());
        }
        if (profile.getResourceSigma() < 0.0) {
            throw new InvalidConfigurationException("Asset " + name + " resource sigma must be non-negative");
        }
        if (!(profile.getCapexPerMw() > 0.0)) {
            throw new InvalidConfigurationException("Asset " + name + " capex must be positive but was " + profile.getCapexPerMw());
        }
        if (profile.getType() == AssetType.WIND) {
            if (!(profile.getWeibullShape() > 0.0) || !(profile.getWeibullScale() > 0.0)) {
                throw new InvalidConfigurationException("Asset " + name + " Weibull shape and scale must be positive");
            }
            if (!(profile.getCutInSpeed() >= 0.0
                    && profile.getCutInSpeed() < profile.getRatedSpeed()
                    && profile.getRatedSpeed() < profile.getCutOutSpeed())) {
                throw new InvalidConfigurationException(
                        "Asset " + name + " power curve needs 0 <= cut-in < rated < cut-out");
            }
            if (Math.abs(profile.getSeasonalAmplitude()) >= 1.0 || Math.abs(profile.getDiurnalAmplitude()) >= 1.0) {
                throw new InvalidConfigurationException("Asset " + name + " modulation amplitudes must be below 1");
            }
        } else {
            if (!(profile.getCloudAlpha() > 0.0) || !(profile.getCloudBeta() > 0.0)) {
                throw new InvalidConfigurationException("Asset " + name + " cloud Beta parameters must be positive");
            }
            if (profile.getCloudImpact() < 0.0 || profile.getCloudImpact() > 1.0) {
                throw new InvalidConfigurationException("Asset " + name + " cloud impact must be in [0, 1]");
            }
            if (!(profile.getPeakIrradiance() > 0.0)) {
                throw new InvalidConfigurationException("Asset " + name + " peak irradiance must be positive");
            }
        }
    }
}
