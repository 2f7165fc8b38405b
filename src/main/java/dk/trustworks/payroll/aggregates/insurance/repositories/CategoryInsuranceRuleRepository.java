package dk.trustworks.payroll.aggregates.insurance.repositories;

import dk.trustworks.payroll.aggregates.insurance.model.CategoryInsuranceRule;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class CategoryInsuranceRuleRepository implements PanacheRepositoryBase<CategoryInsuranceRule, String> {

    /**
     * The rule in force on the date for (category, insurance type), if any.
     */
    public Optional<CategoryInsuranceRule> findEffective(String categoryId, String insuranceTypeId, LocalDate date) {
        return find("categoryId = ?1 AND insuranceTypeId = ?2 AND effectiveDate <= ?3 "
                        + "AND (endDate IS NULL OR endDate > ?3) ORDER BY effectiveDate DESC",
                categoryId, insuranceTypeId, date).firstResultOptional();
    }

    /**
     * All rules in force on the date for the category, one per insurance type.
     */
    public List<CategoryInsuranceRule> findEffectiveForCategory(String categoryId, LocalDate date) {
        return find("categoryId = ?1 AND effectiveDate <= ?2 AND (endDate IS NULL OR endDate > ?2)",
                categoryId, date).list();
    }
}
