package dk.trustworks.payroll.aggregates.period.repositories;

import dk.trustworks.payroll.aggregates.period.model.PayrollPeriod;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class PayrollPeriodRepository implements PanacheRepositoryBase<PayrollPeriod, String> {

    public Optional<PayrollPeriod> findByYearAndMonth(int year, int month) {
        return find("year = ?1 AND month = ?2", year, month).firstResultOptional();
    }

    public List<PayrollPeriod> findByYear(int year) {
        return find("year = ?1 ORDER BY month", year).list();
    }
}
