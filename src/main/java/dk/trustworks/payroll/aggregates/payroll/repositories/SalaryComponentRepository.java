package dk.trustworks.payroll.aggregates.payroll.repositories;

import dk.trustworks.payroll.aggregates.payroll.model.SalaryComponent;
import dk.trustworks.payroll.aggregates.payroll.model.enums.ComponentCategory;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@ApplicationScoped
public class SalaryComponentRepository implements PanacheRepositoryBase<SalaryComponent, String> {

    public Map<String, SalaryComponent> findAllById() {
        return listAll().stream().collect(Collectors.toMap(SalaryComponent::getUuid, Function.identity()));
    }

    /**
     * The component the engine writes calculated deductions of the given category to.
     */
    public Optional<SalaryComponent> findFirstByCategory(ComponentCategory category) {
        return find("category = ?1 ORDER BY name", category).firstResultOptional();
    }
}
