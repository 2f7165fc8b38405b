package dk.trustworks.payroll.aggregates.insurance.repositories;

import dk.trustworks.payroll.aggregates.insurance.model.InsuranceType;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;

@ApplicationScoped
public class InsuranceTypeRepository implements PanacheRepositoryBase<InsuranceType, String> {

    public List<InsuranceType> findActive() {
        return find("active = true ORDER BY key").list();
    }
}
