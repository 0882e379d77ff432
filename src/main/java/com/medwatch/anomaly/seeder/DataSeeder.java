package com.medwatch.anomaly.seeder;

import com.medwatch.anomaly.config.AnomalyEngineConfig;
import com.medwatch.anomaly.model.DataPoint;
import com.medwatch.anomaly.model.RuleType;
import com.medwatch.anomaly.model.SupplyRule;
import com.medwatch.anomaly.repository.MedicineDataRepository;
import com.medwatch.anomaly.repository.RuleRepository;
import com.medwatch.anomaly.service.ModelTrainingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Seeds Aerospike with default rules and a catalogue of medicines for local testing,
 * then trains the global Isolation Forest on it.
 * Only runs when the "seed" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=seed
 *
 * Generates 60 medicines:
 *   - MED-0001 to MED-0054: steady stock, market-level prices, reliable suppliers
 *   - MED-0055 to MED-0060: injected shortages, price spikes, late suppliers and rapid depletion
 */
@Component
@Profile("seed")
@Order(1)
public class DataSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    private static final int NORMAL_MEDICINES = 54;

    private static final String[][] CATALOGUE = {
            // medicineName, genericName, company, disease
            {"Amoxil 500mg", "Amoxicillin", "GSK", "Bacterial infection"},
            {"Glucophage 850mg", "Metformin", "Merck", "Type 2 diabetes"},
            {"Coartem 20/120", "Artemether/Lumefantrine", "Novartis", "Malaria"},
            {"Ventolin Inhaler", "Salbutamol", "GSK", "Asthma"},
            {"Norvasc 5mg", "Amlodipine", "Pfizer", "Hypertension"},
            {"Panadol 500mg", "Paracetamol", "Haleon", "Pain and fever"},
            {"Insulatard", "Human insulin", "Novo Nordisk", "Type 1 diabetes"},
            {"Septrin 480mg", "Co-trimoxazole", "Aspen", "Bacterial infection"},
            {"Tenolam", "Tenofovir/Lamivudine", "Hetero", "HIV"},
    };

    private static final String[] SUPPLIERS = {"MedSupply Ltd", "KEMSA", "PharmaLink", "HealthBridge"};
    private static final String[] LOCATIONS = {"Nairobi Central", "Mombasa", "Kisumu", "Nakuru", "Eldoret"};

    private final RuleRepository ruleRepository;
    private final MedicineDataRepository medicineDataRepository;
    private final ModelTrainingService modelTrainingService;
    private final AnomalyEngineConfig engineConfig;
    private final Random random = new Random(42); // fixed seed for reproducibility

    public DataSeeder(RuleRepository ruleRepository,
                      MedicineDataRepository medicineDataRepository,
                      ModelTrainingService modelTrainingService,
                      AnomalyEngineConfig engineConfig) {
        this.ruleRepository = ruleRepository;
        this.medicineDataRepository = medicineDataRepository;
        this.modelTrainingService = modelTrainingService;
        this.engineConfig = engineConfig;
    }

    @Override
    public void run(String... args) throws Exception {
        log.info("=== Starting data seeding ===");

        seedDefaultRules();
        seedMedicines();
        modelTrainingService.train(engineConfig.getModel().getNumTrees(), engineConfig.getModel().getSampleSize());

        log.info("=== Data seeding complete ===");
    }

    private void seedDefaultRules() {
        log.info("Seeding default supply rules...");

        ruleRepository.save(SupplyRule.builder()
                .ruleId("RULE-LOW-STOCK")
                .name("Low Stock")
                .description("Flag medicines whose stock has fallen below their critical threshold")
                .ruleType(RuleType.LOW_STOCK)
                .threshold(1.0)
                .severity("high")
                .build());

        ruleRepository.save(SupplyRule.builder()
                .ruleId("RULE-DAYS-OF-COVER")
                .name("Stockout Risk")
                .description("Flag medicines that will run out within a week at current consumption")
                .ruleType(RuleType.DAYS_OF_COVER)
                .threshold(7.0)
                .severity("high")
                .params(Map.of("criticalDays", "2"))
                .build());

        ruleRepository.save(SupplyRule.builder()
                .ruleId("RULE-PRICE-SPIKE")
                .name("Price Spike")
                .description("Flag prices more than 30% above the market average")
                .ruleType(RuleType.PRICE_SPIKE)
                .threshold(30.0)
                .severity("medium")
                .params(Map.of("criticalPct", "100"))
                .build());

        ruleRepository.save(SupplyRule.builder()
                .ruleId("RULE-SUPPLIER-DELAY")
                .name("Supplier Delay")
                .description("Flag suppliers running more than 5 days late")
                .ruleType(RuleType.SUPPLIER_DELAY)
                .threshold(5.0)
                .severity("medium")
                .build());

        ruleRepository.save(SupplyRule.builder()
                .ruleId("RULE-RAPID-DEPLETION")
                .name("Rapid Depletion")
                .description("Flag stock falling more than twice as fast as normal consumption")
                .ruleType(RuleType.RAPID_DEPLETION)
                .threshold(2.0)
                .severity("high")
                .build());

        log.info("Seeded 5 default rules");
    }

    private void seedMedicines() {
        List<DataPoint> medicines = new ArrayList<>();
        for (int i = 1; i <= NORMAL_MEDICINES; i++) {
            medicines.add(normalMedicine(i));
        }
        medicines.addAll(anomalousMedicines());

        medicines.forEach(medicineDataRepository::save);
        log.info("Seeded {} medicines ({} with injected anomalies)",
                medicines.size(), medicines.size() - NORMAL_MEDICINES);
    }

    private DataPoint normalMedicine(int index) {
        String[] entry = CATALOGUE[index % CATALOGUE.length];
        double consumption = 10 + random.nextInt(90);
        long stock = Math.round(consumption * (30 + random.nextInt(60)));
        double marketPrice = Math.round((2 + random.nextDouble() * 48) * 100.0) / 100.0;
        double price = Math.round(marketPrice * (0.95 + random.nextDouble() * 0.1) * 100.0) / 100.0;

        return baseMedicine(index, entry)
                .currentStock(stock)
                .currentPrice(price)
                .averageMarketPrice(marketPrice)
                .criticalThreshold(Math.round(consumption * 10))
                .dailyConsumption(consumption)
                .stockHistory(List.of(stock, stock + Math.round(consumption), stock + Math.round(consumption * 2)))
                .priceHistory(List.of(price, marketPrice, marketPrice))
                .supplierDelay(random.nextInt(3))
                .build();
    }

    private List<DataPoint> anomalousMedicines() {
        List<DataPoint> anomalies = new ArrayList<>();

        // Out of stock with a stalled supplier
        anomalies.add(baseMedicine(55, CATALOGUE[2])
                .currentStock(0).currentPrice(9.8).averageMarketPrice(9.5)
                .criticalThreshold(400).dailyConsumption(40)
                .stockHistory(List.of(0L, 90L, 180L)).priceHistory(List.of(9.8, 9.5, 9.5))
                .supplierDelay(12)
                .causesOfShortage("Port clearance backlog")
                .build());

        // Price gouging
        anomalies.add(baseMedicine(56, CATALOGUE[6])
                .currentStock(900).currentPrice(31.0).averageMarketPrice(12.0)
                .criticalThreshold(300).dailyConsumption(30)
                .stockHistory(List.of(900L, 930L, 960L)).priceHistory(List.of(31.0, 18.0, 12.0))
                .supplierDelay(1)
                .build());

        // Rapid depletion, possible diversion
        anomalies.add(baseMedicine(57, CATALOGUE[0])
                .currentStock(600).currentPrice(4.1).averageMarketPrice(4.0)
                .criticalThreshold(250).dailyConsumption(25)
                .stockHistory(List.of(600L, 1100L, 1600L)).priceHistory(List.of(4.1, 4.0, 4.0))
                .supplierDelay(0)
                .build());

        // Stockout within two days
        anomalies.add(baseMedicine(58, CATALOGUE[8])
                .currentStock(70).currentPrice(22.0).averageMarketPrice(21.5)
                .criticalThreshold(60).dailyConsumption(45)
                .stockHistory(List.of(70L, 115L, 160L)).priceHistory(List.of(22.0, 21.5, 21.5))
                .supplierDelay(3)
                .causesOfShortage("Donor funding gap")
                .build());

        // Late supplier, otherwise healthy
        anomalies.add(baseMedicine(59, CATALOGUE[4])
                .currentStock(2400).currentPrice(3.0).averageMarketPrice(3.0)
                .criticalThreshold(200).dailyConsumption(20)
                .stockHistory(List.of(2400L, 2420L, 2440L)).priceHistory(List.of(3.0, 3.0, 3.0))
                .supplierDelay(21)
                .causesOfShortage("Manufacturer recall")
                .build());

        // Volatile prices and a shrinking buffer
        anomalies.add(baseMedicine(60, CATALOGUE[3])
                .currentStock(180).currentPrice(15.0).averageMarketPrice(8.0)
                .criticalThreshold(150).dailyConsumption(20)
                .stockHistory(List.of(180L, 260L, 340L)).priceHistory(List.of(15.0, 6.0, 11.0, 5.0))
                .supplierDelay(7)
                .build());

        return anomalies;
    }

    private DataPoint.DataPointBuilder baseMedicine(int index, String[] entry) {
        return DataPoint.builder()
                .medicineId(String.format("MED-%04d", index))
                .medicineName(entry[0])
                .genericName(entry[1])
                .company(entry[2])
                .disease(entry[3])
                .supplier(SUPPLIERS[index % SUPPLIERS.length])
                .location(LOCATIONS[index % LOCATIONS.length])
                .lastUpdatedAt(Instant.now().minus(random.nextInt(48), ChronoUnit.HOURS).toString());
    }
}
